/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.server;

import com.postbox.utils.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Works out the listening port.
 *
 * <p>The port file ({@code server.port.file}, default {@code myport.info}) holds a single
 * decimal port number. When it is missing, empty, unreadable or not a valid port, the
 * configured {@code server.port} is used, and failing that 1357.
 */
public final class PortResolver {

    public static final int DEFAULT_PORT = 1357;
    public static final String DEFAULT_PORT_FILE = "myport.info";

    private PortResolver() {}

    public static int resolve(Properties config) {
        String portFile = config.getProperty("server.port.file", DEFAULT_PORT_FILE).trim();
        int fallback = fallbackPort(config);
        return resolve(Paths.get(portFile), fallback);
    }

    public static int resolve(Path portFile, int fallbackPort) {
        if (!Files.exists(portFile)) {
            LoggerUtil.warn("Port file " + portFile + " not found, using default port " + fallbackPort);
            return fallbackPort;
        }

        String content;
        try {
            content = Files.readString(portFile, StandardCharsets.US_ASCII).trim();
        } catch (IOException e) {
            LoggerUtil.warn("Failed to read port file " + portFile + ": " + e.getMessage()
                    + ", using default port " + fallbackPort);
            return fallbackPort;
        }

        if (content.isEmpty()) {
            LoggerUtil.warn("Port file " + portFile + " is empty, using default port " + fallbackPort);
            return fallbackPort;
        }

        try {
            int port = Integer.parseInt(content);
            if (isValidPort(port)) {
                LoggerUtil.info("Using port " + port + " from " + portFile);
                return port;
            }
        } catch (NumberFormatException ignored) {
            // reported below together with out-of-range values
        }
        LoggerUtil.warn("Port file " + portFile + " holds an invalid port '" + content
                + "', using default port " + fallbackPort);
        return fallbackPort;
    }

    private static int fallbackPort(Properties config) {
        String value = config.getProperty("server.port");
        if (value == null || value.trim().isEmpty()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(value.trim());
            if (isValidPort(port)) {
                return port;
            }
        } catch (NumberFormatException ignored) {
            // fall through
        }
        LoggerUtil.warn("Invalid value for server.port: " + value + ", using default: " + DEFAULT_PORT);
        return DEFAULT_PORT;
    }

    private static boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }
}
