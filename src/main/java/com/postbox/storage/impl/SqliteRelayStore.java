/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage.impl;

import com.postbox.db.DatabaseManager;
import com.postbox.db.SchemaInitializer;
import com.postbox.db.models.Client;
import com.postbox.db.models.ClientId;
import com.postbox.db.models.StoredMessage;
import com.postbox.protocol.MessageType;
import com.postbox.storage.RelayStore;
import com.postbox.storage.StorageException;
import com.postbox.storage.StoreValidation;
import com.postbox.utils.LoggerUtil;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Relay store backed by SQLite through the HikariCP pool in {@link DatabaseManager}.
 *
 * <p>Every operation holds one store-wide lock for its whole duration. The pending-message
 * fetch additionally runs its select and delete in a single transaction.
 */
public class SqliteRelayStore implements RelayStore {

    private static final String CLIENT_COLUMNS = "id, username, public_key, last_seen";

    private final DatabaseManager databaseManager;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Wraps the pool and creates the schema if needed.
     *
     * @throws StorageException.StorageInitializationException if the schema cannot be created
     */
    public SqliteRelayStore(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
        try {
            SchemaInitializer.initializeSchema(databaseManager);
        } catch (SQLException e) {
            throw new StorageException.StorageInitializationException(
                    "could not create schema in " + databaseManager.getDbPath(), e);
        }
        if (!SchemaInitializer.isSchemaInitialized(databaseManager)) {
            throw new StorageException.StorageInitializationException(
                    "relay tables missing after schema creation in " + databaseManager.getDbPath(), null);
        }
    }

    // ==================== Clients ====================

    @Override
    public boolean addClient(Client client) {
        Optional<String> invalid = StoreValidation.validateClient(client);
        if (invalid.isPresent()) {
            LoggerUtil.error("Client validation failed: " + invalid.get());
            return false;
        }

        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection()) {
            if (findClient(conn, "username", client.username()).isPresent()) {
                LoggerUtil.error("Username already registered: " + client.username());
                return false;
            }
            String sql = "INSERT INTO clients (" + CLIENT_COLUMNS + ") VALUES (?, ?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setBytes(1, client.id().toBytes());
                stmt.setString(2, client.username());
                stmt.setBytes(3, client.publicKey());
                stmt.setString(4, client.lastSeen());
                stmt.executeUpdate();
            }
            return true;
        } catch (SQLException e) {
            // Primary key collision lands here as a constraint violation
            LoggerUtil.error("Failed to add client " + client.id().toHex() + ": " + e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Client> getClientByUsername(String username) {
        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection()) {
            return findClient(conn, "username", username);
        } catch (SQLException e) {
            LoggerUtil.error("Failed to look up client by username: " + e.getMessage());
            throw new StorageException("Failed to look up client by username", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Client> getClientById(ClientId id) {
        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection()) {
            return findClient(conn, "id", id.toBytes());
        } catch (SQLException e) {
            LoggerUtil.error("Failed to look up client " + id.toHex() + ": " + e.getMessage());
            throw new StorageException("Failed to look up client by id", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Client> listClients() {
        String sql = "SELECT " + CLIENT_COLUMNS + " FROM clients ORDER BY rowid ASC";

        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            List<Client> clients = new ArrayList<>();
            while (rs.next()) {
                clients.add(mapClient(rs));
            }
            return clients;

        } catch (SQLException e) {
            LoggerUtil.error("Failed to list clients: " + e.getMessage());
            throw new StorageException("Failed to list clients", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateLastSeen(ClientId id) {
        String sql = "UPDATE clients SET last_seen = ? WHERE id = ?";

        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, Client.currentLastSeen());
            stmt.setBytes(2, id.toBytes());
            stmt.executeUpdate();

        } catch (SQLException e) {
            LoggerUtil.error("Failed to update last seen for " + id.toHex() + ": " + e.getMessage());
            throw new StorageException("Failed to update last seen", e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Messages ====================

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

        String sql = "INSERT INTO messages (to_client, from_client, type, content) VALUES (?, ?, ?, ?)";

        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setBytes(1, toClient.toBytes());
                stmt.setBytes(2, fromClient.toBytes());
                stmt.setInt(3, type.getValue());
                stmt.setBytes(4, content);
                stmt.executeUpdate();
            }

            // Same connection and still under the lock, so this is our row
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                if (rs.next()) {
                    return OptionalLong.of(rs.getLong(1));
                }
            }
            LoggerUtil.error("Message insert returned no id");
            return OptionalLong.empty();

        } catch (SQLException e) {
            LoggerUtil.error("Failed to store message for " + toClient.toHex() + ": " + e.getMessage());
            return OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredMessage> fetchAndRemovePending(ClientId clientId) {
        String select = "SELECT id, to_client, from_client, type, content FROM messages "
                + "WHERE to_client = ? ORDER BY id ASC";
        String delete = "DELETE FROM messages WHERE id = ?";

        lock.lock();
        try (Connection conn = databaseManager.getDataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<StoredMessage> pending = new ArrayList<>();
                try (PreparedStatement stmt = conn.prepareStatement(select)) {
                    stmt.setBytes(1, clientId.toBytes());
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            pending.add(mapMessage(rs));
                        }
                    }
                }

                if (!pending.isEmpty()) {
                    try (PreparedStatement stmt = conn.prepareStatement(delete)) {
                        for (StoredMessage message : pending) {
                            stmt.setLong(1, message.id());
                            stmt.addBatch();
                        }
                        stmt.executeBatch();
                    }
                }

                conn.commit();
                return pending;

            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            LoggerUtil.error("Failed to fetch pending messages for " + clientId.toHex() + ": " + e.getMessage());
            throw new StorageException("Failed to fetch pending messages", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        LoggerUtil.debug(databaseManager::getStats);
        databaseManager.close();
    }

    // ==================== Row mapping ====================

    private Optional<Client> findClient(Connection conn, String column, Object value) throws SQLException {
        String sql = "SELECT " + CLIENT_COLUMNS + " FROM clients WHERE " + column + " = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, value);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapClient(rs)) : Optional.empty();
            }
        }
    }

    private static Client mapClient(ResultSet rs) throws SQLException {
        return new Client(
                ClientId.of(rs.getBytes("id")),
                rs.getString("username"),
                rs.getBytes("public_key"),
                rs.getString("last_seen")
        );
    }

    private static StoredMessage mapMessage(ResultSet rs) throws SQLException {
        int rawType = rs.getInt("type");
        MessageType type = MessageType.fromWire(rawType)
                .orElseThrow(() -> new StorageException("Unknown message type in store: " + rawType));
        byte[] content = rs.getBytes("content");
        return new StoredMessage(
                rs.getLong("id"),
                ClientId.of(rs.getBytes("to_client")),
                ClientId.of(rs.getBytes("from_client")),
                type,
                content != null ? content : new byte[0]
        );
    }
}
