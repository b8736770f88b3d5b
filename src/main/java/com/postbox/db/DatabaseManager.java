/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.db;

import com.postbox.utils.LoggerUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Manages the SQLite connection pool.
 *
 * Built once at startup and handed to the store that needs it. Handles database
 * file creation and path setup.
 */
public class DatabaseManager implements AutoCloseable {
    private final HikariDataSource dataSource;
    private final String dbPath;

    /**
     * @param dbPath   path to the SQLite database file
     * @param poolSize maximum pooled connections
     */
    public DatabaseManager(String dbPath, int poolSize) {
        this.dbPath = dbPath;

        // Ensure parent directory exists
        createParentDirectoryIfNeeded(dbPath);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbPath);
        config.setPoolName("postbox-sqlite");
        config.setMaximumPoolSize(Math.max(1, poolSize));
        config.setConnectionTimeout(30000); // 30 seconds
        config.setIdleTimeout(600000); // 10 minutes
        config.setMaxLifetime(1800000); // 30 minutes

        // SQLite-specific settings
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "5000");

        this.dataSource = new HikariDataSource(config);

        LoggerUtil.info("Database connection pool initialized: " + dbPath);
    }

    /**
     * Gets the HikariCP data source for database connections.
     *
     * @return HikariDataSource for connection management
     */
    public HikariDataSource getDataSource() {
        return dataSource;
    }

    public String getDbPath() {
        return dbPath;
    }

    private void createParentDirectoryIfNeeded(String dbPath) {
        Path path = Paths.get(dbPath);
        Path parentDir = path.getParent();

        if (parentDir != null) {
            File dir = parentDir.toFile();
            if (!dir.exists()) {
                boolean created = dir.mkdirs();
                if (created) {
                    LoggerUtil.info("Created database directory: " + parentDir);
                } else {
                    LoggerUtil.warn("Failed to create database directory: " + parentDir);
                }
            }
        }
    }

    /**
     * Closes the connection pool. Called during application shutdown.
     */
    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            LoggerUtil.info("Database connection pool closed");
        }
    }

    /**
     * Gets basic pool statistics for monitoring.
     */
    public String getStats() {
        if (dataSource == null || dataSource.getHikariPoolMXBean() == null) {
            return "DatabaseManager not initialized";
        }

        return String.format("DB Pool - Active: %d, Idle: %d, Total: %d, Pending: %d",
            dataSource.getHikariPoolMXBean().getActiveConnections(),
            dataSource.getHikariPoolMXBean().getIdleConnections(),
            dataSource.getHikariPoolMXBean().getTotalConnections(),
            dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection()
        );
    }
}
