/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.storage;

/**
 * Base exception for storage operations.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when storage initialization fails.
     */
    public static class StorageInitializationException extends StorageException {
        public StorageInitializationException(String message, Throwable cause) {
            super("Storage initialization failed: " + message, cause);
        }
    }
}
