/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.core;

/**
 * A well-framed request that failed validation. The client gets the generic error
 * response; the message only goes to the server log.
 */
public class RequestRejectedException extends Exception {

    public RequestRejectedException(String message) {
        super(message);
    }
}
