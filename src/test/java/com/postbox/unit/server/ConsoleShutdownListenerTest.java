/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.unit.server;

import com.postbox.server.ConsoleShutdownListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConsoleShutdownListener")
class ConsoleShutdownListenerTest {

    private static ByteArrayInputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should clear the running flag on the shutdown command")
    void shouldStopOnCommand() {
        AtomicBoolean running = new AtomicBoolean(true);

        new ConsoleShutdownListener(input("hello\n  q  \nmore\n"), "q", running).run();

        assertFalse(running.get());
    }

    @Test
    @DisplayName("should accept the shutdown command in upper case")
    void shouldStopOnUpperCaseCommand() {
        AtomicBoolean running = new AtomicBoolean(true);

        new ConsoleShutdownListener(input("Q\n"), "q", running).run();

        assertFalse(running.get());
    }

    @Test
    @DisplayName("should keep running when input ends without the command")
    void shouldKeepRunningOnEof() {
        AtomicBoolean running = new AtomicBoolean(true);

        new ConsoleShutdownListener(input("quit\nqq\n"), "q", running).run();

        assertTrue(running.get());
    }
}
