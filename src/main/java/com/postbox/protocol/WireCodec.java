/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol;

import com.postbox.db.models.ClientId;
import com.postbox.db.models.StoredMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encoding and decoding of the fixed request/response headers and the per-opcode payload records.
 *
 * <p>Header layouts (little-endian):
 * <pre>
 * request : client_id[16] | version u8 | opcode u16 | payload_size u32 | payload
 * response: version u8 | code u16 | payload_size u32 | payload
 * </pre>
 */
public final class WireCodec {

    private WireCodec() {}

    // ==================== Headers ====================

    /**
     * Reads one request header from {@code in}, advancing its reader index by 23 bytes.
     *
     * @throws IllegalArgumentException if fewer than 23 bytes are readable
     */
    public static RequestHeader decodeHeader(ByteBuf in) {
        if (in.readableBytes() < ProtocolConstants.REQUEST_HEADER_SIZE) {
            throw new IllegalArgumentException("Request header needs " + ProtocolConstants.REQUEST_HEADER_SIZE
                    + " bytes, have " + in.readableBytes());
        }
        byte[] id = new byte[ProtocolConstants.CLIENT_ID_SIZE];
        in.readBytes(id);
        int version = in.readUnsignedByte();
        int opcode = in.readUnsignedShortLE();
        long payloadSize = in.readUnsignedIntLE();
        return new RequestHeader(ClientId.of(id), version, opcode, payloadSize);
    }

    public static RequestHeader decodeHeader(byte[] header) {
        return decodeHeader(Unpooled.wrappedBuffer(header));
    }

    /**
     * Builds the outbound buffer for a response. Error responses are header-only with a zero size,
     * whatever payload the caller attached.
     */
    public static ByteBuf encodeResponse(Response response, int version) {
        byte[] payload = response.isError() ? new byte[0] : response.payload();
        ByteBuf out = Unpooled.buffer(ProtocolConstants.RESPONSE_HEADER_SIZE + payload.length);
        out.writeByte(version);
        out.writeShortLE(response.code().getValue());
        out.writeIntLE(payload.length);
        out.writeBytes(payload);
        return out;
    }

    // ==================== Usernames ====================

    /**
     * Decodes a null-padded username field as strict ASCII with trailing nulls trimmed.
     *
     * @return the username, or empty if the bytes are not ASCII
     */
    public static Optional<String> decodeUsername(byte[] field) {
        CharsetDecoder decoder = StandardCharsets.US_ASCII.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String decoded;
        try {
            decoded = decoder.decode(ByteBuffer.wrap(field)).toString();
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
        int end = decoded.length();
        while (end > 0 && decoded.charAt(end - 1) == '\0') {
            end--;
        }
        return Optional.of(decoded.substring(0, end));
    }

    /**
     * Encodes a username into its fixed 255-byte wire field. Shorter names are null padded;
     * longer ones are cut to 254 bytes followed by a null.
     *
     * @return the padded field, or empty if the name cannot be encoded as ASCII
     */
    public static Optional<byte[]> encodeUsername(String username) {
        CharsetEncoder encoder = StandardCharsets.US_ASCII.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        byte[] raw;
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(username));
            raw = new byte[encoded.remaining()];
            encoded.get(raw);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
        byte[] field = new byte[ProtocolConstants.USERNAME_SIZE];
        int copy = Math.min(raw.length, ProtocolConstants.MAX_USERNAME_LENGTH);
        System.arraycopy(raw, 0, field, 0, copy);
        return Optional.of(field);
    }

    // ==================== Payload records ====================

    public static void writeClientEntry(ByteBuf out, ClientId id, byte[] usernameField) {
        out.writeBytes(id.toBytes());
        out.writeBytes(usernameField);
    }

    public static byte[] encodePublicKeyResponse(ClientId id, byte[] publicKey) {
        ByteBuf out = Unpooled.buffer(ProtocolConstants.PUBLIC_KEY_RESPONSE_SIZE);
        out.writeBytes(id.toBytes());
        out.writeBytes(publicKey);
        return toBytes(out);
    }

    public static byte[] encodeMessageSentResponse(ClientId target, long messageId) {
        ByteBuf out = Unpooled.buffer(ProtocolConstants.MESSAGE_SENT_RESPONSE_SIZE);
        out.writeBytes(target.toBytes());
        out.writeIntLE((int) messageId);
        return toBytes(out);
    }

    /**
     * Appends one pending-message record: sender | message id | type | content size | content.
     */
    public static void writePendingRecord(ByteBuf out, StoredMessage message) {
        out.writeBytes(message.fromClient().toBytes());
        out.writeIntLE((int) message.id());
        out.writeByte(message.type().getValue());
        out.writeIntLE(message.content().length);
        out.writeBytes(message.content());
    }

    /**
     * Copies the readable bytes out and releases the buffer.
     */
    public static byte[] toBytes(ByteBuf buf) {
        try {
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }
}
