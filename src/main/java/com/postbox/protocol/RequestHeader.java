/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import com.postbox.db.models.ClientId;

/**
 * Decoded 23-byte request header. Unsigned wire fields are widened so they never go negative.
 */
public record RequestHeader(
    ClientId clientId,
    int version,
    int opcode,
    long payloadSize
) {
}
