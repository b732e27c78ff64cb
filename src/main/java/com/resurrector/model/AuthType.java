package com.resurrector.model;

import java.util.Locale;

/**
 * Authentication schemes understood when calling a live endpoint.
 */
public enum AuthType {
    NONE,
    BEARER,
    API_KEY,
    BASIC,
    WSSE;

    /**
     * Parses the loose spellings callers use ("api-key", "apiKey", "Bearer", ...).
     * Blank input means {@link #NONE}; anything unrecognised is rejected.
     */
    public static AuthType parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return switch (normalized) {
            case "none" -> NONE;
            case "bearer" -> BEARER;
            case "apikey" -> API_KEY;
            case "basic" -> BASIC;
            case "wsse" -> WSSE;
            default -> throw new IllegalArgumentException("Unsupported auth type: " + value);
        };
    }
}
