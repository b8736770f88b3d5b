/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.unit.protocol;

import com.postbox.protocol.MessageType;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.ResponseCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Protocol code tables")
class ProtocolCodesTest {

    @Test
    @DisplayName("Request opcodes map to 600..604 and nothing else")
    void requestCodesFromWire() {
        assertEquals(Optional.of(RequestCode.REGISTER), RequestCode.fromWire(600));
        assertEquals(Optional.of(RequestCode.FETCH_PENDING), RequestCode.fromWire(604));
        assertTrue(RequestCode.fromWire(599).isEmpty());
        assertTrue(RequestCode.fromWire(605).isEmpty());
    }

    @Test
    @DisplayName("Response codes carry their wire values")
    void responseCodeValues() {
        assertEquals(2100, ResponseCode.REGISTRATION_SUCCESS.getValue());
        assertEquals(2101, ResponseCode.USER_LIST.getValue());
        assertEquals(2102, ResponseCode.PUBLIC_KEY.getValue());
        assertEquals(2103, ResponseCode.MESSAGE_SENT.getValue());
        assertEquals(2104, ResponseCode.PENDING_MESSAGES_RECEIVED.getValue());
        assertEquals(9000, ResponseCode.ERROR.getValue());
    }

    @Test
    @DisplayName("Key requests must be empty, other types need content")
    void messageTypeContentRules() {
        assertAll(
                () -> assertTrue(MessageType.SYMMETRIC_KEY_REQUEST.acceptsContentLength(0)),
                () -> assertFalse(MessageType.SYMMETRIC_KEY_REQUEST.acceptsContentLength(1)),
                () -> assertFalse(MessageType.SYMMETRIC_KEY_SEND.acceptsContentLength(0)),
                () -> assertTrue(MessageType.SYMMETRIC_KEY_SEND.acceptsContentLength(128)),
                () -> assertFalse(MessageType.TEXT_MESSAGE_SEND.acceptsContentLength(0)),
                () -> assertTrue(MessageType.TEXT_MESSAGE_SEND.acceptsContentLength(1))
        );
    }

    @Test
    @DisplayName("Unknown message types are not mapped")
    void unknownMessageType() {
        assertEquals(Optional.of(MessageType.TEXT_MESSAGE_SEND), MessageType.fromWire(3));
        assertTrue(MessageType.fromWire(0).isEmpty());
        assertTrue(MessageType.fromWire(4).isEmpty());
    }
}
