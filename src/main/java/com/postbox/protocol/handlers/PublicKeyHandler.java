/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.handlers;

import com.postbox.db.models.Client;
import com.postbox.db.models.ClientId;
import com.postbox.protocol.ProtocolConstants;
import com.postbox.protocol.Request;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.Response;
import com.postbox.protocol.ResponseCode;
import com.postbox.protocol.WireCodec;
import com.postbox.protocol.core.RequestHandler;
import com.postbox.protocol.core.RequestRejectedException;
import com.postbox.storage.RelayStore;

/**
 * Returns another client's public key (opcode 602). Payload is the 16-byte target id.
 */
public class PublicKeyHandler implements RequestHandler {

    @Override
    public RequestCode getCode() {
        return RequestCode.FETCH_PUBLIC_KEY;
    }

    @Override
    public Response handle(Request request, RelayStore store) throws RequestRejectedException {
        if (request.payloadSize() != ProtocolConstants.CLIENT_ID_SIZE) {
            throw new RequestRejectedException("Invalid payload size for public key retrieval: "
                    + request.payloadSize());
        }

        ClientId targetId = ClientId.of(request.payload());
        Client target = store.getClientById(targetId)
                .orElseThrow(() -> new RequestRejectedException("Client not found: " + targetId.toHex()));

        byte[] publicKey = target.publicKey();
        if (publicKey == null || publicKey.length != ProtocolConstants.PUBLIC_KEY_SIZE) {
            throw new RequestRejectedException("Stored public key has invalid size for " + targetId.toHex());
        }

        return Response.of(ResponseCode.PUBLIC_KEY, WireCodec.encodePublicKeyResponse(target.id(), publicKey));
    }
}
