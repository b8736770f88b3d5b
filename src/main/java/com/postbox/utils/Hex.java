/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.postbox.utils;

/**
 * Hex utilities (lowercase output, matching how client ids are shown in logs).
 */
public final class Hex {

    private static final char[] LOWER_HEX = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String bytesToHex(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte x : bytes) {
            int v = x & 0xFF;
            sb.append(LOWER_HEX[v >>> 4]).append(LOWER_HEX[v & 0x0F]);
        }
        return sb.toString();
    }
}
