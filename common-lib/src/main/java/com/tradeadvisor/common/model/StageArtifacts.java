package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Artifacts a run had completed when it stopped. Attached to pipeline errors for
 * diagnosis only; never presented as a successful plan. All fields nullable.
 */
public record StageArtifacts(
    @JsonProperty("analyst")    AnalystRecommendation analyst,
    @JsonProperty("setup")      TradingSetup          setup,
    @JsonProperty("allocation") RiskAllocation        allocation
) {
    private static final StageArtifacts EMPTY = new StageArtifacts(null, null, null);

    public static StageArtifacts empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return analyst == null && setup == null && allocation == null;
    }
}
