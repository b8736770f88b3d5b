/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import java.util.Optional;

/**
 * Request opcodes accepted by the server. Anything else on the wire is a framing error.
 */
public enum RequestCode {
    REGISTER(600),
    LIST_CLIENTS(601),
    FETCH_PUBLIC_KEY(602),
    SEND_MESSAGE(603),
    FETCH_PENDING(604);

    private final int value;

    RequestCode(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static Optional<RequestCode> fromWire(int value) {
        for (RequestCode code : values()) {
            if (code.value == value) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
