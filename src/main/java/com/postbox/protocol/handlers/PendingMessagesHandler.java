/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.handlers;

import com.postbox.db.models.StoredMessage;
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

import java.util.List;

/**
 * Delivers and purges the requester's pending messages (opcode 604).
 *
 * <p>Fetching is delivery: the store removes the messages in the same step that returns them.
 */
public class PendingMessagesHandler implements RequestHandler {

    @Override
    public RequestCode getCode() {
        return RequestCode.FETCH_PENDING;
    }

    @Override
    public Response handle(Request request, RelayStore store) throws RequestRejectedException {
        if (request.payloadSize() != 0) {
            throw new RequestRejectedException("Pending messages request must have an empty payload, got "
                    + request.payloadSize() + " bytes");
        }

        List<StoredMessage> messages = store.fetchAndRemovePending(request.clientId());
        ByteBuf out = Unpooled.buffer();
        for (StoredMessage message : messages) {
            WireCodec.writePendingRecord(out, message);
        }

        if (!messages.isEmpty()) {
            LoggerUtil.info("Delivered " + messages.size() + " pending message(s) to " + request.clientId().toHex());
        }
        return Response.of(ResponseCode.PENDING_MESSAGES_RECEIVED, WireCodec.toBytes(out));
    }
}
