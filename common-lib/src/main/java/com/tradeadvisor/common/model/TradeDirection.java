package com.tradeadvisor.common.model;

import com.tradeadvisor.common.exception.ValidationException;

import java.util.Locale;

/**
 * Directional call produced by the analyst stage.
 *
 * <ul>
 *   <li>LONG     : expect the price to rise: enter long</li>
 *   <li>SHORT    : expect the price to fall: enter short</li>
 *   <li>NO_TRADE : no actionable setup; the pipeline short-circuits after the analyst</li>
 * </ul>
 */
public enum TradeDirection {

    LONG,
    SHORT,
    NO_TRADE;

    public boolean isActionable() {
        return this != NO_TRADE;
    }

    /**
     * Parses a direction from reasoning output. Accepts {@code "NO TRADE"} and
     * {@code "no-trade"} spellings. Anything unrecognised is rejected rather than
     * mapped to a default.
     */
    public static TradeDirection parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Trade direction missing", text);
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (TradeDirection direction : values()) {
            if (direction.name().equals(normalized)) return direction;
        }
        throw new ValidationException("Unknown trade direction: " + text, text);
    }
}
