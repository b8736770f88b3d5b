/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.db.models;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A registered client: identity, display name and the public key other clients fetch.
 *
 * <p>{@code lastSeen} is free text; new registrations carry {@link #LAST_SEEN_UNAVAILABLE}
 * until the first request from that id is framed.
 */
public record Client(
    ClientId id,
    String username,
    byte[] publicKey,
    String lastSeen
) {
    public static final String LAST_SEEN_UNAVAILABLE = "Not Available";

    private static final DateTimeFormatter LAST_SEEN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Creates a client for a fresh registration.
     */
    public static Client createNew(ClientId id, String username, byte[] publicKey) {
        return new Client(id, username, publicKey, LAST_SEEN_UNAVAILABLE);
    }

    /**
     * Current local time in the last-seen text format.
     */
    public static String currentLastSeen() {
        return LAST_SEEN_FORMAT.format(LocalDateTime.now());
    }

    public Client withLastSeen(String lastSeen) {
        return new Client(id, username, publicKey, lastSeen);
    }
}
