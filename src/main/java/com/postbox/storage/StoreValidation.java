/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage;

import com.postbox.db.models.Client;
import com.postbox.protocol.MessageType;
import com.postbox.protocol.ProtocolConstants;

import java.util.Optional;

/**
 * Field checks every {@link RelayStore} applies before inserting.
 */
public final class StoreValidation {

    private StoreValidation() {}

    /**
     * @return the reason the client is invalid, or empty if it may be inserted
     */
    public static Optional<String> validateClient(Client client) {
        if (client == null || client.id() == null) {
            return Optional.of("missing client id");
        }
        String username = client.username();
        if (username == null || username.isEmpty()) {
            return Optional.of("empty username");
        }
        if (username.length() > ProtocolConstants.MAX_USERNAME_LENGTH) {
            return Optional.of("username longer than " + ProtocolConstants.MAX_USERNAME_LENGTH + " bytes");
        }
        if (!username.chars().allMatch(c -> c < 0x80)) {
            return Optional.of("username is not ASCII");
        }
        if (client.publicKey() == null || client.publicKey().length != ProtocolConstants.PUBLIC_KEY_SIZE) {
            return Optional.of("public key must be " + ProtocolConstants.PUBLIC_KEY_SIZE + " bytes");
        }
        if (client.lastSeen() == null || client.lastSeen().isEmpty()) {
            return Optional.of("missing last-seen value");
        }
        return Optional.empty();
    }

    /**
     * @return the reason the message is invalid, or empty if it may be inserted
     */
    public static Optional<String> validateMessage(MessageType type, byte[] content) {
        if (type == null) {
            return Optional.of("missing message type");
        }
        if (content == null) {
            return Optional.of("missing content");
        }
        if (!type.acceptsContentLength(content.length)) {
            return Optional.of("content length " + content.length + " not allowed for " + type);
        }
        return Optional.empty();
    }
}
