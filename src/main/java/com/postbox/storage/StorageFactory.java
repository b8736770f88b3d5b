/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage;

import com.postbox.db.DatabaseManager;
import com.postbox.storage.impl.InMemoryRelayStore;
import com.postbox.storage.impl.SqliteRelayStore;
import com.postbox.utils.LoggerUtil;

import java.util.Properties;

/**
 * Factory for creating RelayStore instances based on configuration.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>store.type - "sqlite" (default) or "memory"</li>
 *   <li>db.path - SQLite database file (default: "db/postbox.db")</li>
 *   <li>db.pool.size - maximum pooled connections (default: 4)</li>
 * </ul>
 */
public class StorageFactory {

    private static final String DEFAULT_DB_PATH = "db/postbox.db";
    private static final int DEFAULT_POOL_SIZE = 4;

    /**
     * Create RelayStore from configuration.
     *
     * @param config application properties
     * @return configured store, owned by the caller
     * @throws StorageException.StorageInitializationException if the database cannot be prepared
     */
    public static RelayStore create(Properties config) {
        String type = config.getProperty("store.type", "sqlite").trim();

        return switch (type.toLowerCase()) {
            case "sqlite" -> createSqliteStore(config);
            case "memory" -> createInMemoryStore();
            default -> {
                LoggerUtil.warn("[StorageFactory] Unknown store type '" + type + "', falling back to sqlite");
                yield createSqliteStore(config);
            }
        };
    }

    public static SqliteRelayStore createSqliteStore(Properties config) {
        String dbPath = config.getProperty("db.path", DEFAULT_DB_PATH).trim();
        if (dbPath.isEmpty()) {
            LoggerUtil.warn("[StorageFactory] Empty db.path, using default: " + DEFAULT_DB_PATH);
            dbPath = DEFAULT_DB_PATH;
        }
        int poolSize = parseInt(config, "db.pool.size", DEFAULT_POOL_SIZE);

        LoggerUtil.info("[StorageFactory] Creating SqliteRelayStore at: " + dbPath);

        DatabaseManager databaseManager = new DatabaseManager(dbPath, poolSize);
        try {
            return new SqliteRelayStore(databaseManager);
        } catch (RuntimeException e) {
            databaseManager.close();
            throw e;
        }
    }

    public static InMemoryRelayStore createInMemoryStore() {
        LoggerUtil.info("[StorageFactory] Creating InMemoryRelayStore (contents are lost on exit)");
        return new InMemoryRelayStore();
    }

    private static int parseInt(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.warn("[StorageFactory] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }
}
