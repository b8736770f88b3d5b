/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.handlers;

import com.postbox.db.models.Client;
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
import java.util.Optional;

/**
 * Lists every registered client except the requester (opcode 601).
 * Each entry is the 16-byte id followed by the 255-byte padded username.
 */
public class ClientListHandler implements RequestHandler {

    @Override
    public RequestCode getCode() {
        return RequestCode.LIST_CLIENTS;
    }

    @Override
    public Response handle(Request request, RelayStore store) throws RequestRejectedException {
        if (request.payloadSize() != 0) {
            throw new RequestRejectedException("Client list request must have an empty payload, got "
                    + request.payloadSize() + " bytes");
        }

        List<Client> clients = store.listClients();
        ByteBuf out = Unpooled.buffer();
        for (Client client : clients) {
            if (client.id().equals(request.clientId())) {
                continue;
            }
            Optional<byte[]> field = WireCodec.encodeUsername(client.username());
            if (field.isEmpty()) {
                LoggerUtil.error("Skipping client with unencodable username: " + client.id().toHex());
                continue;
            }
            WireCodec.writeClientEntry(out, client.id(), field.get());
        }
        return Response.of(ResponseCode.USER_LIST, WireCodec.toBytes(out));
    }
}
