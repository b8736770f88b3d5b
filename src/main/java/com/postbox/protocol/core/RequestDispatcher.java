/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.protocol.core;

import com.postbox.protocol.Request;
import com.postbox.protocol.RequestCode;
import com.postbox.protocol.Response;
import com.postbox.protocol.handlers.ClientListHandler;
import com.postbox.protocol.handlers.PendingMessagesHandler;
import com.postbox.protocol.handlers.PublicKeyHandler;
import com.postbox.protocol.handlers.RegistrationHandler;
import com.postbox.protocol.handlers.SendMessageHandler;
import com.postbox.storage.RelayStore;
import com.postbox.utils.LoggerUtil;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Opcode dispatch table.
 *
 * <p>Routes each framed request to the handler registered for its opcode and turns
 * validation failures into the generic error response. One dispatcher, and the one store
 * it was built with, are shared by every connection.
 */
public class RequestDispatcher {

    private final RelayStore store;
    private final Map<RequestCode, RequestHandler> handlers = new EnumMap<>(RequestCode.class);

    public RequestDispatcher(RelayStore store, List<RequestHandler> handlers) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
        for (RequestHandler handler : handlers) {
            RequestHandler existing = this.handlers.put(handler.getCode(), handler);
            if (existing != null) {
                LoggerUtil.warn(String.format("Replaced handler for %s (was: %s, now: %s)",
                        handler.getCode(), existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
    }

    /**
     * Builds the dispatcher with the five standard handlers.
     */
    public static RequestDispatcher withDefaultHandlers(RelayStore store) {
        return new RequestDispatcher(store, List.of(
                new RegistrationHandler(),
                new ClientListHandler(),
                new PublicKeyHandler(),
                new SendMessageHandler(),
                new PendingMessagesHandler()
        ));
    }

    /**
     * Runs the handler for {@code code}.
     *
     * @return the handler's response, or the generic error response if it rejected the request
     * @throws IllegalStateException if no handler is registered for the opcode
     */
    public Response dispatch(RequestCode code, Request request) {
        RequestHandler handler = handlers.get(code);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + code);
        }
        try {
            return handler.handle(request, store);
        } catch (RequestRejectedException e) {
            LoggerUtil.warn(String.format("%s rejected for client %s: %s",
                    code, request.clientId().toHex(), e.getMessage()));
            return Response.error();
        }
    }

    public boolean hasHandler(RequestCode code) {
        return handlers.containsKey(code);
    }

    public RelayStore getStore() {
        return store;
    }
}
