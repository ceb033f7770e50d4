package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptive technical read of the chart. Only {@code trend} carries an invariant,
 * and it is enforced by {@link AnalystRecommendation}: non-blank for LONG/SHORT calls.
 * {@code momentum}, {@code volume} and {@code volatility} are optional free text.
 */
public record TechnicalFactors(
    @JsonProperty("trend")        String           trend,
    @JsonProperty("keyLevels")    List<PriceLevel> keyLevels,
    @JsonProperty("patternNotes") String           patternNotes,
    @JsonProperty("momentum")     String           momentum,
    @JsonProperty("volume")       String           volume,
    @JsonProperty("volatility")   String           volatility
) {
    public TechnicalFactors {
        keyLevels = keyLevels == null ? List.of() : List.copyOf(keyLevels);
    }

    public static TechnicalFactors of(String trend, List<PriceLevel> keyLevels, String patternNotes) {
        return new TechnicalFactors(trend, keyLevels, patternNotes, null, null, null);
    }

    public boolean hasTrend() {
        return trend != null && !trend.isBlank();
    }
}
