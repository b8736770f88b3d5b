/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

/**
 * Violation of the header/payload length contract, or an opcode the server does not know.
 * Always fatal to the connection: it is closed without a response.
 */
public class FramingException extends Exception {

    public FramingException(String message) {
        super(message);
    }
}
