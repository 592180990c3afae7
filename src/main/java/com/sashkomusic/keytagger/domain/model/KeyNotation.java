package com.sashkomusic.keytagger.domain.model;

import java.util.Locale;

public enum KeyNotation {
    CLASSIC,
    ALPHANUMERIC;

    public static KeyNotation parse(String value) {
        if (value == null || value.isBlank()) {
            return CLASSIC;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "classic" -> CLASSIC;
            case "alphanumeric", "camelot" -> ALPHANUMERIC;
            default -> throw new IllegalArgumentException("Unknown key notation: " + value);
        };
    }
}
