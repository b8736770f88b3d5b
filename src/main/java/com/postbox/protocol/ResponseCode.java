/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

public enum ResponseCode {
    REGISTRATION_SUCCESS(2100),
    USER_LIST(2101),
    PUBLIC_KEY(2102),
    MESSAGE_SENT(2103),
    PENDING_MESSAGES_RECEIVED(2104),
    /** Generic failure. Never carries a payload; detail stays in the server log. */
    ERROR(9000);

    private final int value;

    ResponseCode(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
