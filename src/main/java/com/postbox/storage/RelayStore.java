/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage;

import com.postbox.db.models.Client;
import com.postbox.db.models.ClientId;
import com.postbox.db.models.StoredMessage;
import com.postbox.protocol.MessageType;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence contract for registered clients and pending messages.
 *
 * <p>Thread Safety: every operation of an implementation is serialized through one lock
 * covering the whole store. Connections may therefore be served from any number of
 * event loop threads.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link com.postbox.storage.impl.SqliteRelayStore} - SQLite through a HikariCP pool</li>
 *   <li>{@link com.postbox.storage.impl.InMemoryRelayStore} - process-lifetime maps</li>
 * </ul>
 */
public interface RelayStore extends AutoCloseable {

    // ==================== Clients ====================

    /**
     * Inserts a new client.
     *
     * <p>Fails, without throwing, when the id is already taken, the username is already
     * registered, or a field has the wrong size (id 16 bytes, username 1..254 ASCII bytes,
     * key 160 bytes, non-empty last-seen). The username check happens inside the same
     * critical section as the insert.
     *
     * @return true if the row was inserted
     */
    boolean addClient(Client client);

    Optional<Client> getClientByUsername(String username);

    Optional<Client> getClientById(ClientId id);

    /**
     * @return all clients in registration order
     */
    List<Client> listClients();

    /**
     * Stamps the client's last-seen time with the current local time. Unknown ids are ignored.
     */
    void updateLastSeen(ClientId id);

    // ==================== Messages ====================

    /**
     * Stores a message for later delivery.
     *
     * @return the new message id, or empty if the message failed validation or could not be stored
     */
    OptionalLong addMessage(ClientId toClient, ClientId fromClient, MessageType type, byte[] content);

    /**
     * Returns every message addressed to {@code clientId}, in insertion order, and deletes
     * exactly those messages before returning. Read and delete happen in one critical
     * section, so a returned message can never be returned again.
     */
    List<StoredMessage> fetchAndRemovePending(ClientId clientId);

    /**
     * Releases underlying resources.
     */
    @Override
    void close();
}
