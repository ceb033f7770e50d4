package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;

import java.time.Instant;
import java.util.List;

/**
 * Output of the analyst stage: a directional call with conviction and the technical
 * read supporting it.
 *
 * <p>A NO_TRADE call still carries a conviction and technical factors; it only tells
 * the orchestrator not to run the trader and risk stages. For LONG/SHORT calls the
 * technical trend must be non-blank.
 *
 * <p>{@code fundamentalFactors} is nullable and present only when research was used.
 */
public record AnalystRecommendation(
    @JsonProperty("symbol")             String             symbol,
    @JsonProperty("direction")          TradeDirection     direction,
    @JsonProperty("conviction")         ConvictionLevel    conviction,
    @JsonProperty("technicalFactors")   TechnicalFactors   technicalFactors,
    @JsonProperty("fundamentalFactors") FundamentalFactors fundamentalFactors,
    @JsonProperty("keyObservations")    List<String>       keyObservations,
    @JsonProperty("rationale")          String             rationale,
    @JsonProperty("createdAt")          Instant            createdAt
) {
    public AnalystRecommendation {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Analyst recommendation has no symbol");
        }
        if (direction == null) {
            throw new ValidationException("Analyst recommendation has no direction", symbol);
        }
        if (conviction == null) {
            throw new ValidationException("Analyst recommendation has no conviction", symbol);
        }
        if (technicalFactors == null) {
            throw new ValidationException("Analyst recommendation has no technical factors", symbol);
        }
        if (direction.isActionable() && !technicalFactors.hasTrend()) {
            throw new ValidationException(
                "Technical trend must be described for a " + direction + " call", technicalFactors);
        }
        if (createdAt == null) {
            throw new ValidationException("Analyst recommendation has no creation timestamp", symbol);
        }
        keyObservations = keyObservations == null ? List.of() : List.copyOf(keyObservations);
        rationale = rationale == null ? "" : rationale;
    }

    public boolean isActionable() {
        return direction.isActionable();
    }
}
