/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.db.models;

import com.postbox.protocol.ProtocolConstants;
import com.postbox.utils.Hex;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.UUID;

/**
 * 16-byte opaque client identifier.
 *
 * <p>Immutable; the backing array is copied on the way in and on the way out so ids
 * can be used as map keys and compared by value.
 */
public final class ClientId {

    private final byte[] bytes;

    private ClientId(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a copy of the given bytes.
     *
     * @throws IllegalArgumentException if the array is null or not exactly 16 bytes
     */
    public static ClientId of(byte[] bytes) {
        if (bytes == null || bytes.length != ProtocolConstants.CLIENT_ID_SIZE) {
            throw new IllegalArgumentException("Client id must be " + ProtocolConstants.CLIENT_ID_SIZE
                    + " bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new ClientId(bytes.clone());
    }

    /**
     * Generates a fresh random id from a type 4 UUID.
     */
    public static ClientId random() {
        UUID uuid = UUID.randomUUID();
        ByteBuffer buf = ByteBuffer.allocate(ProtocolConstants.CLIENT_ID_SIZE);
        buf.putLong(uuid.getMostSignificantBits());
        buf.putLong(uuid.getLeastSignificantBits());
        return new ClientId(buf.array());
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.bytesToHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientId)) return false;
        return Arrays.equals(bytes, ((ClientId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
