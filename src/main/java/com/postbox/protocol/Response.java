/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

/**
 * Response produced by a request handler, before the header is stamped on.
 */
public record Response(ResponseCode code, byte[] payload) {

    private static final byte[] EMPTY = new byte[0];

    public static Response of(ResponseCode code, byte[] payload) {
        return new Response(code, payload != null ? payload : EMPTY);
    }

    public static Response error() {
        return new Response(ResponseCode.ERROR, EMPTY);
    }

    public boolean isError() {
        return code == ResponseCode.ERROR;
    }
}
