/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.core;

import com.postbox.protocol.Request;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.Response;
import com.postbox.storage.RelayStore;

/**
 * Processor for one request opcode. Implementations hold no per-connection state.
 */
public interface RequestHandler {

    /**
     * @return the opcode this handler serves
     */
    RequestCode getCode();

    /**
     * Validate the request and produce the success response.
     *
     * @param request the framed request
     * @param store   the client/message store
     * @return the success response
     * @throws RequestRejectedException if a validation rule fails; the first failing rule wins
     */
    Response handle(Request request, RelayStore store) throws RequestRejectedException;
}
