/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

/**
 * Wire layout constants for the relay protocol (single source of truth).
 * All multi-byte integers on the wire are little-endian and unsigned.
 */
public final class ProtocolConstants {

    private ProtocolConstants() {}

    public static final int DEFAULT_SERVER_VERSION = 2;

    // Field sizes
    public static final int CLIENT_ID_SIZE = 16;
    public static final int USERNAME_SIZE = 255;
    public static final int MAX_USERNAME_LENGTH = USERNAME_SIZE - 1;
    public static final int PUBLIC_KEY_SIZE = 160;
    public static final int MESSAGE_TYPE_SIZE = 1;
    public static final int CONTENT_SIZE_SIZE = 4;
    public static final int MESSAGE_ID_SIZE = 4;

    // Request header: client id | version(u8) | opcode(u16) | payload size(u32)
    public static final int REQUEST_HEADER_SIZE = CLIENT_ID_SIZE + 1 + 2 + 4;

    // Response header: version(u8) | code(u16) | payload size(u32)
    public static final int RESPONSE_HEADER_SIZE = 1 + 2 + 4;

    // Derived payload sizes
    public static final int REGISTRATION_PAYLOAD_SIZE = USERNAME_SIZE + PUBLIC_KEY_SIZE;
    public static final int SEND_MESSAGE_HEADER_SIZE = CLIENT_ID_SIZE + MESSAGE_TYPE_SIZE + CONTENT_SIZE_SIZE;
    public static final int CLIENT_ENTRY_SIZE = CLIENT_ID_SIZE + USERNAME_SIZE;
    public static final int PUBLIC_KEY_RESPONSE_SIZE = CLIENT_ID_SIZE + PUBLIC_KEY_SIZE;
    public static final int MESSAGE_SENT_RESPONSE_SIZE = CLIENT_ID_SIZE + MESSAGE_ID_SIZE;
    public static final int PENDING_RECORD_HEADER_SIZE =
            CLIENT_ID_SIZE + MESSAGE_ID_SIZE + MESSAGE_TYPE_SIZE + CONTENT_SIZE_SIZE;

    public static final long MAX_UNSIGNED_INT = 0xFFFFFFFFL;
}
