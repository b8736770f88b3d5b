/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage.impl;

import com.postbox.db.models.Client;
import com.postbox.db.models.ClientId;
import com.postbox.db.models.StoredMessage;
import com.postbox.protocol.MessageType;
import com.postbox.storage.RelayStore;
import com.postbox.storage.StoreValidation;
import com.postbox.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relay store held entirely in memory. Contents are lost when the process exits.
 *
 * <p>Uses the same single-lock discipline as {@link SqliteRelayStore}; maps keep
 * insertion order so listings and pending fetches come back oldest first.
 */
public class InMemoryRelayStore implements RelayStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ClientId, Client> clients = new LinkedHashMap<>();
    private final Map<Long, StoredMessage> messages = new LinkedHashMap<>();
    private long nextMessageId = 1L;

    @Override
    public boolean addClient(Client client) {
        Optional<String> invalid = StoreValidation.validateClient(client);
        if (invalid.isPresent()) {
            LoggerUtil.error("Client validation failed: " + invalid.get());
            return false;
        }
        lock.lock();
        try {
            if (clients.containsKey(client.id())) {
                LoggerUtil.error("Client id collision: " + client.id().toHex());
                return false;
            }
            boolean usernameTaken = clients.values().stream()
                    .anyMatch(existing -> existing.username().equals(client.username()));
            if (usernameTaken) {
                LoggerUtil.error("Username already registered: " + client.username());
                return false;
            }
            clients.put(client.id(), client);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Client> getClientByUsername(String username) {
        lock.lock();
        try {
            return clients.values().stream()
                    .filter(client -> client.username().equals(username))
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Client> getClientById(ClientId id) {
        lock.lock();
        try {
            return Optional.ofNullable(clients.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Client> listClients() {
        lock.lock();
        try {
            return new ArrayList<>(clients.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateLastSeen(ClientId id) {
        lock.lock();
        try {
            clients.computeIfPresent(id, (key, client) -> client.withLastSeen(Client.currentLastSeen()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalLong addMessage(ClientId toClient, ClientId fromClient, MessageType type, byte[] content) {
        if (toClient == null || fromClient == null) {
            LoggerUtil.error("Message validation failed: missing client id");
            return OptionalLong.empty();
        }
        Optional<String> invalid = StoreValidation.validateMessage(type, content);
        if (invalid.isPresent()) {
            LoggerUtil.error("Message validation failed: " + invalid.get());
            return OptionalLong.empty();
        }
        lock.lock();
        try {
            long id = nextMessageId++;
            messages.put(id, new StoredMessage(id, toClient, fromClient, type, content.clone()));
            return OptionalLong.of(id);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredMessage> fetchAndRemovePending(ClientId clientId) {
        lock.lock();
        try {
            List<StoredMessage> pending = new ArrayList<>();
            Iterator<StoredMessage> it = messages.values().iterator();
            while (it.hasNext()) {
                StoredMessage message = it.next();
                if (message.toClient().equals(clientId)) {
                    pending.add(message);
                    it.remove();
                }
            }
            return pending;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            LoggerUtil.info(String.format("In-memory store closed (%d clients, %d undelivered messages dropped)",
                    clients.size(), messages.size()));
        } finally {
            lock.unlock();
        }
    }
}
