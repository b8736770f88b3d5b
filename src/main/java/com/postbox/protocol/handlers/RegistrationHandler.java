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
import com.postbox.utils.LoggerUtil;

import java.util.Arrays;

/**
 * Registers a new client (opcode 600).
 *
 * <p>Payload: 255-byte null-padded ASCII username followed by the 160-byte public key.
 * Replies with the freshly generated 16-byte client id.
 */
public class RegistrationHandler implements RequestHandler {

    @Override
    public RequestCode getCode() {
        return RequestCode.REGISTER;
    }

    @Override
    public Response handle(Request request, RelayStore store) throws RequestRejectedException {
        byte[] payload = request.payload();
        if (payload.length != ProtocolConstants.REGISTRATION_PAYLOAD_SIZE) {
            throw new RequestRejectedException("Invalid payload size for registration: " + payload.length);
        }

        byte[] usernameField = Arrays.copyOfRange(payload, 0, ProtocolConstants.USERNAME_SIZE);
        byte[] publicKey = Arrays.copyOfRange(payload, ProtocolConstants.USERNAME_SIZE, payload.length);

        String username = WireCodec.decodeUsername(usernameField)
                .orElseThrow(() -> new RequestRejectedException("Username is not valid ASCII"));
        if (username.isEmpty()) {
            throw new RequestRejectedException("Empty username");
        }
        if (store.getClientByUsername(username).isPresent()) {
            throw new RequestRejectedException("Username already exists: " + username);
        }

        ClientId newId = ClientId.random();
        if (!store.addClient(Client.createNew(newId, username, publicKey))) {
            throw new RequestRejectedException("Store refused client " + username + " (" + newId.toHex() + ")");
        }

        LoggerUtil.info("Registered new client: " + username + " with id: " + newId.toHex());
        return Response.of(ResponseCode.REGISTRATION_SUCCESS, newId.toBytes());
    }
}
