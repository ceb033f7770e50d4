package com.tradeadvisor.common.model;

import com.tradeadvisor.common.exception.ValidationException;

import java.util.Locale;

/**
 * Qualitative confidence attached to a directional call. Declaration order is the
 * total order LOW &lt; MEDIUM &lt; HIGH, so {@link #compareTo} can be used directly.
 */
public enum ConvictionLevel {

    LOW,
    MEDIUM,
    HIGH;

    /**
     * Strict parse: only the three level names (case-insensitive) are accepted.
     * Blank, "NONE" or any other value is a {@link ValidationException}.
     */
    public static ConvictionLevel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Conviction level missing", text);
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (ConvictionLevel level : values()) {
            if (level.name().equals(normalized)) return level;
        }
        throw new ValidationException("Conviction level out of range: " + text, text);
    }
}
