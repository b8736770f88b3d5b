/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox;

import com.postbox.protocol.core.RequestDispatcher;
import com.postbox.server.ConsoleShutdownListener;
import com.postbox.server.PortResolver;
import com.postbox.server.PostboxServer;
import com.postbox.storage.RelayStore;
import com.postbox.storage.StorageFactory;
import com.postbox.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Launcher for the Postbox relay.
 *
 * <p>Loads configuration, opens the store, starts the TCP server and then waits until the
 * console shutdown command (or a JVM shutdown) arrives.
 */
public class PostboxApplication {

    private static final long DEFAULT_POLL_MS = 1000L;

    private static final AtomicBoolean running = new AtomicBoolean(true);
    private static final AtomicBoolean stopped = new AtomicBoolean(false);

    private static volatile PostboxServer server;
    private static volatile RelayStore store;

    public static void main(String[] args) {
        try {
            printBanner();

            Properties config = loadConfiguration();
            LoggerUtil.setDebugEnabled(Boolean.parseBoolean(config.getProperty("verbose", "false").trim()));
            if (LoggerUtil.isDebugEnabled()) {
                PostboxServer.enableTrafficLogging();
                LoggerUtil.info("Verbose logging enabled");
            }

            store = StorageFactory.create(config);
            RequestDispatcher dispatcher = RequestDispatcher.withDefaultHandlers(store);

            int port = PortResolver.resolve(config);
            server = new PostboxServer(port, config, dispatcher);
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                shutdown();
            }, "Shutdown-Hook"));

            String command = config.getProperty("shutdown.command", "q").trim();
            new ConsoleShutdownListener(System.in, command, running).start();

            LoggerUtil.info("");
            LoggerUtil.info("========================================");
            LoggerUtil.info("Postbox relay started on port " + server.getBoundPort());
            LoggerUtil.info("========================================");
            LoggerUtil.info("");

            long pollMs = parsePollMs(config);
            while (running.get()) {
                Thread.sleep(pollMs);
            }

            shutdown();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.warn("Interrupted, shutting down");
            shutdown();
        } catch (Exception e) {
            LoggerUtil.error("Failed to start Postbox relay: " + e.getMessage());
            e.printStackTrace();
            shutdown();
            System.exit(1);
        }
    }

    /**
     * Loads configuration from application.properties.
     *
     * <p>Classpath defaults first, then overrides from {@code resources/application.properties}
     * in the working directory if that file exists.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = PostboxApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {

            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }

            config.load(inputStream);
            LoggerUtil.info("Loaded classpath configuration as defaults");
        }

        Path externalConfigPath = Paths.get("resources", "application.properties");
        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from external file: " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                LoggerUtil.info("Loaded external configuration overrides (" + externalConfig.size() + " properties)");
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load external configuration overrides: " + e.getMessage());
            }
        }

        return config;
    }

    private static long parsePollMs(Properties config) {
        String value = config.getProperty("shutdown.poll.ms", String.valueOf(DEFAULT_POLL_MS)).trim();
        try {
            long pollMs = Long.parseLong(value);
            if (pollMs > 0) {
                return pollMs;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        LoggerUtil.warn("Invalid value for shutdown.poll.ms: " + value + ", using default: " + DEFAULT_POLL_MS);
        return DEFAULT_POLL_MS;
    }

    private static void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            if (server != null) {
                LoggerUtil.info("Stopping server...");
                server.stop();
            }
            if (store != null) {
                store.close();
                LoggerUtil.info("Store closed");
            }
            LoggerUtil.info("Postbox relay shutdown complete");
        } catch (Exception e) {
            LoggerUtil.error("Error during shutdown: " + e.getMessage());
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  +------------------------------------------+");
        System.out.println("  |   POSTBOX  store-and-forward relay       |");
        System.out.println("  +------------------------------------------+");
        System.out.println();
    }
}
