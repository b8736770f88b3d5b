/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.db.models;

import com.postbox.protocol.MessageType;

/**
 * A message waiting for its recipient. The content is opaque ciphertext.
 */
public record StoredMessage(
    long id,
    ClientId toClient,
    ClientId fromClient,
    MessageType type,
    byte[] content
) {
}
