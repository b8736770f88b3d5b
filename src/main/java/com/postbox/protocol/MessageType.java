/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import java.util.Optional;

/**
 * Kinds of relayed payload. The server only cares about the content-length rule
 * each kind imposes; the bytes themselves are opaque.
 */
public enum MessageType {
    /** Asks the recipient for a symmetric key. Carries no content. */
    SYMMETRIC_KEY_REQUEST(1, false),
    /** Symmetric key encrypted under the recipient's public key. */
    SYMMETRIC_KEY_SEND(2, true),
    /** Text encrypted under the shared symmetric key. */
    TEXT_MESSAGE_SEND(3, true);

    private final int value;
    private final boolean requiresContent;

    MessageType(int value, boolean requiresContent) {
        this.value = value;
        this.requiresContent = requiresContent;
    }

    public int getValue() {
        return value;
    }

    /**
     * Checks the content length rule for this type: empty for key requests,
     * at least one byte for everything else.
     */
    public boolean acceptsContentLength(long contentLength) {
        return requiresContent ? contentLength >= 1 : contentLength == 0;
    }

    public static Optional<MessageType> fromWire(int value) {
        for (MessageType type : values()) {
            if (type.value == value) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
