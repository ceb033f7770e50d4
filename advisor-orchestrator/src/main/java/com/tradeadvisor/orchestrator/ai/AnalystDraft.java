package com.tradeadvisor.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.ConvictionLevel;
import com.tradeadvisor.common.model.FundamentalFactors;
import com.tradeadvisor.common.model.PriceLevel;
import com.tradeadvisor.common.model.TechnicalFactors;
import com.tradeadvisor.common.model.TradeDirection;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Analyst reasoning output as parsed from JSON. Direction and conviction stay strings
 * until {@link #toRecommendation} so that an out-of-range value is reported as a
 * validation failure with the offending text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalystDraft(
    @JsonProperty("direction")          String             direction,
    @JsonProperty("conviction")         String             conviction,
    @JsonProperty("technicalFactors")   TechnicalDraft     technicalFactors,
    @JsonProperty("fundamentalFactors") FundamentalFactors fundamentalFactors,
    @JsonProperty("keyObservations")    List<String>       keyObservations,
    @JsonProperty("rationale")          String             rationale
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TechnicalDraft(
        @JsonProperty("trend")        String         trend,
        @JsonProperty("keyLevels")    List<LevelDraft> keyLevels,
        @JsonProperty("patternNotes") String         patternNotes,
        @JsonProperty("momentum")     String         momentum,
        @JsonProperty("volume")       String         volume,
        @JsonProperty("volatility")   String         volatility
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LevelDraft(
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("label") String     label
    ) {}

    /** @throws ValidationException when any field breaks the recommendation invariants */
    public AnalystRecommendation toRecommendation(String symbol, Instant createdAt) {
        TradeDirection parsedDirection = TradeDirection.parse(direction);
        ConvictionLevel parsedConviction = ConvictionLevel.parse(conviction);
        if (technicalFactors == null) {
            throw new ValidationException("Analyst output has no technical factors", this);
        }
        if (technicalFactors.keyLevels() != null && technicalFactors.keyLevels().contains(null)) {
            throw new ValidationException("Analyst key levels must not contain blanks", this);
        }
        if (keyObservations != null && keyObservations.contains(null)) {
            throw new ValidationException("Analyst observations must not contain blanks", this);
        }
        List<PriceLevel> levels = technicalFactors.keyLevels() == null ? List.of()
            : technicalFactors.keyLevels().stream()
                .map(l -> new PriceLevel(l.price(), l.label()))
                .toList();
        TechnicalFactors technicals = new TechnicalFactors(
            technicalFactors.trend(), levels, technicalFactors.patternNotes(),
            technicalFactors.momentum(), technicalFactors.volume(), technicalFactors.volatility());
        FundamentalFactors fundamentals = fundamentalFactors == null || fundamentalFactors.isEmpty()
            ? null : fundamentalFactors;
        return new AnalystRecommendation(symbol, parsedDirection, parsedConviction, technicals,
                                         fundamentals, keyObservations, rationale, createdAt);
    }
}
