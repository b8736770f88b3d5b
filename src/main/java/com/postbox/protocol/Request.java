/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import com.postbox.db.models.ClientId;

/**
 * A fully framed request: header plus exactly {@code header.payloadSize()} payload bytes.
 */
public record Request(RequestHeader header, byte[] payload) {

    public ClientId clientId() {
        return header.clientId();
    }

    public int payloadSize() {
        return payload.length;
    }
}
