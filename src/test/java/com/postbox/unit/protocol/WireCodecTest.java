/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.unit.protocol;

import com.postbox.db.models.ClientId;
import com.postbox.db.models.StoredMessage;
import com.postbox.protocol.MessageType;
import com.postbox.protocol.ProtocolConstants;
import com.postbox.protocol.RequestHeader;
import com.postbox.protocol.Response;
import com.postbox.protocol.ResponseCode;
import com.postbox.protocol.WireCodec;
import com.postbox.support.ClientFrames;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WireCodec - byte layout of headers, responses and payload records.
 */
@DisplayName("WireCodec Tests")
class WireCodecTest {

    private static final ClientId ALICE = ClientFrames.clientId("00112233445566778899aabbccddeeff");
    private static final ClientId BOB = ClientFrames.clientId("ffeeddccbbaa99887766554433221100");

    @Nested
    @DisplayName("Request Header")
    class RequestHeaderTests {

        @Test
        @DisplayName("Should decode little-endian opcode and payload size")
        void shouldDecodeLittleEndianFields() {
            byte[] frame = new byte[ProtocolConstants.REQUEST_HEADER_SIZE];
            System.arraycopy(ALICE.toBytes(), 0, frame, 0, 16);
            frame[16] = 2;
            frame[17] = 0x58;  // 600 = 0x0258
            frame[18] = 0x02;
            frame[19] = (byte) 0x9F; // 415 = 0x019F
            frame[20] = 0x01;

            RequestHeader header = WireCodec.decodeHeader(frame);

            assertAll(
                    () -> assertEquals(ALICE, header.clientId()),
                    () -> assertEquals(2, header.version()),
                    () -> assertEquals(600, header.opcode()),
                    () -> assertEquals(415L, header.payloadSize())
            );
        }

        @Test
        @DisplayName("Should read unsigned values above the signed range")
        void shouldReadUnsignedValues() {
            byte[] frame = new byte[ProtocolConstants.REQUEST_HEADER_SIZE];
            Arrays.fill(frame, 16, 23, (byte) 0xFF);

            RequestHeader header = WireCodec.decodeHeader(frame);

            assertEquals(255, header.version());
            assertEquals(65535, header.opcode());
            assertEquals(ProtocolConstants.MAX_UNSIGNED_INT, header.payloadSize());
        }

        @Test
        @DisplayName("Should consume exactly 23 bytes from a buffer")
        void shouldConsumeExactlyHeaderBytes() {
            byte[] frame = ClientFrames.encodeRequest(ALICE, 2, 601, new byte[]{9, 9, 9});
            ByteBuf buf = Unpooled.wrappedBuffer(frame);

            WireCodec.decodeHeader(buf);

            assertEquals(3, buf.readableBytes());
            buf.release();
        }

        @Test
        @DisplayName("Should reject a short header")
        void shouldRejectShortHeader() {
            assertThrows(IllegalArgumentException.class, () -> WireCodec.decodeHeader(new byte[22]));
        }
    }

    @Nested
    @DisplayName("Response Encoding")
    class ResponseEncodingTests {

        @Test
        @DisplayName("Should write version, code and size before the payload")
        void shouldWriteResponseHeader() {
            byte[] encoded = WireCodec.toBytes(WireCodec.encodeResponse(
                    Response.of(ResponseCode.REGISTRATION_SUCCESS, ALICE.toBytes()), 2));

            assertEquals(ProtocolConstants.RESPONSE_HEADER_SIZE + 16, encoded.length);
            assertEquals(2, encoded[0]);
            assertEquals(0x34, encoded[1] & 0xFF);  // 2100 = 0x0834
            assertEquals(0x08, encoded[2] & 0xFF);
            assertEquals(16, encoded[3]);
            assertEquals(0, encoded[4]);
            assertArrayEquals(ALICE.toBytes(), Arrays.copyOfRange(encoded, 7, 23));
        }

        @Test
        @DisplayName("Should drop any payload from an error response")
        void shouldEncodeErrorWithEmptyPayload() {
            Response error = new Response(ResponseCode.ERROR, new byte[]{1, 2, 3});

            byte[] encoded = WireCodec.toBytes(WireCodec.encodeResponse(error, 2));

            assertArrayEquals(new byte[]{2, 0x28, 0x23, 0, 0, 0, 0}, encoded);  // 9000 = 0x2328
        }
    }

    @Nested
    @DisplayName("Usernames")
    class UsernameTests {

        @Test
        @DisplayName("Should trim trailing nulls when decoding")
        void shouldTrimTrailingNulls() {
            byte[] field = new byte[ProtocolConstants.USERNAME_SIZE];
            byte[] name = "alice".getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(name, 0, field, 0, name.length);

            assertEquals(Optional.of("alice"), WireCodec.decodeUsername(field));
        }

        @Test
        @DisplayName("Should reject non-ASCII bytes")
        void shouldRejectNonAscii() {
            byte[] field = new byte[ProtocolConstants.USERNAME_SIZE];
            field[0] = (byte) 0xC3;
            field[1] = (byte) 0xA9;

            assertTrue(WireCodec.decodeUsername(field).isEmpty());
        }

        @Test
        @DisplayName("Should pad to 255 bytes and keep a terminating null on long names")
        void shouldTruncateLongNames() {
            String longName = "x".repeat(300);

            byte[] field = WireCodec.encodeUsername(longName).orElseThrow();

            assertEquals(ProtocolConstants.USERNAME_SIZE, field.length);
            assertEquals('x', field[253]);
            assertEquals(0, field[254]);
        }

        @Test
        @DisplayName("Should refuse to encode non-ASCII names")
        void shouldRefuseNonAsciiNames() {
            assertTrue(WireCodec.encodeUsername("café").isEmpty());
        }
    }

    @Nested
    @DisplayName("Payload Records")
    class PayloadRecordTests {

        @Test
        @DisplayName("Should lay out a pending record as sender, id, type, size, content")
        void shouldWritePendingRecord() {
            byte[] content = "hi".getBytes(StandardCharsets.US_ASCII);
            StoredMessage message = new StoredMessage(7L, BOB, ALICE, MessageType.TEXT_MESSAGE_SEND, content);
            ByteBuf out = Unpooled.buffer();

            WireCodec.writePendingRecord(out, message);
            byte[] record = WireCodec.toBytes(out);

            assertEquals(ProtocolConstants.PENDING_RECORD_HEADER_SIZE + 2, record.length);
            assertArrayEquals(ALICE.toBytes(), Arrays.copyOfRange(record, 0, 16));
            assertArrayEquals(new byte[]{7, 0, 0, 0}, Arrays.copyOfRange(record, 16, 20));
            assertEquals(3, record[20]);
            assertArrayEquals(new byte[]{2, 0, 0, 0}, Arrays.copyOfRange(record, 21, 25));
            assertArrayEquals(content, Arrays.copyOfRange(record, 25, 27));
        }

        @Test
        @DisplayName("Should encode message-sent response as target id and u32 message id")
        void shouldEncodeMessageSent() {
            byte[] encoded = WireCodec.encodeMessageSentResponse(BOB, 258L);

            assertEquals(ProtocolConstants.MESSAGE_SENT_RESPONSE_SIZE, encoded.length);
            assertArrayEquals(BOB.toBytes(), Arrays.copyOfRange(encoded, 0, 16));
            assertArrayEquals(new byte[]{2, 1, 0, 0}, Arrays.copyOfRange(encoded, 16, 20));
        }

        @Test
        @DisplayName("Should build a 415-byte registration payload")
        void shouldBuildRegistrationPayload() {
            byte[] key = new byte[ProtocolConstants.PUBLIC_KEY_SIZE];
            Arrays.fill(key, (byte) 0x5A);

            byte[] payload = ClientFrames.encodeRegistrationPayload("bob", key);

            assertEquals(ProtocolConstants.REGISTRATION_PAYLOAD_SIZE, payload.length);
            assertEquals('b', payload[0]);
            assertEquals(0, payload[3]);
            assertEquals(0x5A, payload[255]);
        }
    }
}
