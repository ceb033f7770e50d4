package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;

import java.time.Instant;

/**
 * Final output of a run: the three stage artifacts and a deterministic executive
 * summary.
 *
 * <p>{@code setup} and {@code allocation} are both present or both null, and they are
 * present exactly when the analyst direction is LONG or SHORT.
 */
public record CompleteTradePlan(
    @JsonProperty("symbol")           String                symbol,
    @JsonProperty("status")           PlanStatus            status,
    @JsonProperty("analyst")          AnalystRecommendation analyst,
    @JsonProperty("setup")            TradingSetup          setup,
    @JsonProperty("allocation")       RiskAllocation        allocation,
    @JsonProperty("executiveSummary") String                executiveSummary,
    @JsonProperty("createdAt")        Instant               createdAt
) {
    public CompleteTradePlan {
        if (analyst == null) {
            throw new ValidationException("Trade plan has no analyst recommendation", symbol);
        }
        if ((setup == null) != (allocation == null)) {
            throw new ValidationException("Setup and allocation must be both present or both absent",
                new StageArtifacts(analyst, setup, allocation));
        }
        if (analyst.isActionable() != (setup != null)) {
            throw new ValidationException("Setup presence does not match analyst direction "
                + analyst.direction(), new StageArtifacts(analyst, setup, allocation));
        }
        if (status == null) {
            throw new ValidationException("Trade plan has no status", symbol);
        }
    }

    public boolean isExecutable() {
        return status == PlanStatus.COMPLETE;
    }
}
