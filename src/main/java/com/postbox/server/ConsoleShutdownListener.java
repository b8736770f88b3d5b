/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.server;

import com.postbox.utils.LoggerUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads console lines and clears the shared running flag when the shutdown command is entered
 * (in either case).
 *
 * <p>End of input stops the listener but leaves the server running, so a detached
 * process keeps serving.
 */
public class ConsoleShutdownListener implements Runnable {

    private final InputStream input;
    private final String command;
    private final AtomicBoolean running;

    public ConsoleShutdownListener(InputStream input, String command, AtomicBoolean running) {
        this.input = input;
        this.command = command;
        this.running = running;
    }

    @Override
    public void run() {
        LoggerUtil.info("Type '" + command + "' and press Enter to stop the server");
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (running.get() && (line = reader.readLine()) != null) {
                if (command.equalsIgnoreCase(line.trim())) {
                    LoggerUtil.info("Shutdown command received");
                    running.set(false);
                    return;
                }
            }
            if (running.get()) {
                LoggerUtil.info("Console input closed; use a signal to stop the server");
            }
        } catch (IOException e) {
            LoggerUtil.warn("Console listener stopped: " + e.getMessage());
        }
    }

    /**
     * Starts the listener on a daemon thread so it never holds the JVM open.
     */
    public Thread start() {
        Thread thread = new Thread(this, "Console-Shutdown-Listener");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
