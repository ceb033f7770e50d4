package com.tradeadvisor.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.model.TradeDirection;
import com.tradeadvisor.common.model.TradingSetup;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Trader reasoning output as parsed from JSON. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SetupDraft(
    @JsonProperty("direction")   String           direction,
    @JsonProperty("entry")       BigDecimal       entry,
    @JsonProperty("stopLoss")    BigDecimal       stopLoss,
    @JsonProperty("takeProfits") List<BigDecimal> takeProfits,
    @JsonProperty("rationale")   String           rationale
) {
    /** Validates ordering and derives risk per share; see {@link TradingSetup}. */
    public TradingSetup toSetup(String symbol, Instant createdAt) {
        return TradingSetup.of(symbol, TradeDirection.parse(direction), entry, stopLoss,
                               takeProfits, rationale, createdAt);
    }
}
