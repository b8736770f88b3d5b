/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.db;

import com.postbox.utils.LoggerUtil;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the relay schema: registered clients and pending messages.
 */
public class SchemaInitializer {

    /**
     * Initializes the database schema if it doesn't exist.
     * Safe to call multiple times - only creates tables that don't exist.
     *
     * @param databaseManager Database connection manager
     * @throws SQLException if schema initialization fails
     */
    public static void initializeSchema(DatabaseManager databaseManager) throws SQLException {
        LoggerUtil.info("Initializing database schema...");

        try (Connection conn = databaseManager.getDataSource().getConnection();
             Statement stmt = conn.createStatement()) {

            createClientsTable(stmt);
            createMessagesTable(stmt);
            createIndexes(stmt);

            LoggerUtil.info("Database schema initialization completed successfully");
        }
    }

    /**
     * Clients are never deleted; last_seen is text so the registration sentinel fits.
     */
    private static void createClientsTable(Statement stmt) throws SQLException {
        String createClientsTable = """
            CREATE TABLE IF NOT EXISTS clients (
                id BLOB NOT NULL PRIMARY KEY,
                username TEXT NOT NULL UNIQUE,
                public_key BLOB NOT NULL,
                last_seen TEXT NOT NULL,
                CHECK(length(id) = 16),
                CHECK(length(username) >= 1 AND length(username) <= 254)
            )
        """;

        stmt.execute(createClientsTable);
        LoggerUtil.debug("Created clients table");
    }

    /**
     * AUTOINCREMENT keeps message ids monotonic even after the newest row is deleted.
     * Client references are not constrained. Key requests store an empty (or NULL) content.
     */
    private static void createMessagesTable(Statement stmt) throws SQLException {
        String createMessagesTable = """
            CREATE TABLE IF NOT EXISTS messages (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                to_client BLOB NOT NULL,
                from_client BLOB NOT NULL,
                type INTEGER NOT NULL,
                content BLOB
            )
        """;

        stmt.execute(createMessagesTable);
        LoggerUtil.debug("Created messages table");
    }

    private static void createIndexes(Statement stmt) throws SQLException {
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_messages_to_client ON messages(to_client)");
        LoggerUtil.debug("Created database indexes");
    }

    /**
     * Checks if both relay tables exist.
     */
    public static boolean isSchemaInitialized(DatabaseManager databaseManager) {
        try (Connection conn = databaseManager.getDataSource().getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("""
                SELECT name FROM sqlite_master
                WHERE type='table' AND name IN ('clients', 'messages')
             """)) {

            int tableCount = 0;
            while (rs.next()) {
                tableCount++;
            }
            return tableCount == 2;

        } catch (SQLException e) {
            LoggerUtil.warn("Failed to check schema initialization: " + e.getMessage());
            return false;
        }
    }
}
