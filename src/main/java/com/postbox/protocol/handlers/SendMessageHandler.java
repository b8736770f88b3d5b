/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.handlers;

import com.postbox.db.models.ClientId;
import com.postbox.protocol.MessageType;
import com.postbox.protocol.ProtocolConstants;
import com.postbox.protocol.Request;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.Response;
import com.postbox.protocol.ResponseCode;
import com.postbox.protocol.WireCodec;
import com.postbox.protocol.core.RequestHandler;
import com.postbox.protocol.core.RequestRejectedException;
import com.postbox.storage.RelayStore;
import com.postbox.utils.LoggerUtil;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Stores a message for a recipient (opcode 603).
 *
 * <p>Payload: target id(16) | type(u8) | content size(u32 LE) | content.
 * The declared content size must account for the rest of the payload exactly.
 */
public class SendMessageHandler implements RequestHandler {

    @Override
    public RequestCode getCode() {
        return RequestCode.SEND_MESSAGE;
    }

    @Override
    public Response handle(Request request, RelayStore store) throws RequestRejectedException {
        if (request.payloadSize() < ProtocolConstants.SEND_MESSAGE_HEADER_SIZE) {
            throw new RequestRejectedException("Invalid payload size for message: " + request.payloadSize());
        }

        ByteBuf in = Unpooled.wrappedBuffer(request.payload());
        byte[] target = new byte[ProtocolConstants.CLIENT_ID_SIZE];
        in.readBytes(target);
        int rawType = in.readUnsignedByte();
        long contentSize = in.readUnsignedIntLE();

        if (ProtocolConstants.SEND_MESSAGE_HEADER_SIZE + contentSize != request.payloadSize()) {
            throw new RequestRejectedException(String.format(
                    "Payload size %d does not match content size %d", request.payloadSize(), contentSize));
        }

        MessageType type = MessageType.fromWire(rawType)
                .orElseThrow(() -> new RequestRejectedException("Unknown message type: " + rawType));
        if (!type.acceptsContentLength(contentSize)) {
            throw new RequestRejectedException(String.format(
                    "Content size %d not allowed for %s", contentSize, type));
        }

        byte[] content = new byte[(int) contentSize];
        in.readBytes(content);

        ClientId targetId = ClientId.of(target);
        long messageId = store.addMessage(targetId, request.clientId(), type, content)
                .orElseThrow(() -> new RequestRejectedException("Failed to store message for " + targetId.toHex()));

        LoggerUtil.info(String.format("Stored %s #%d from %s to %s (%d bytes)",
                type, messageId, request.clientId().toHex(), targetId.toHex(), contentSize));
        return Response.of(ResponseCode.MESSAGE_SENT, WireCodec.encodeMessageSentResponse(targetId, messageId));
    }
}
