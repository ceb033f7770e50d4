package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.model.StageArtifacts;
import com.tradeadvisor.common.model.TradingSetup;
import com.tradeadvisor.orchestrator.pipeline.PlanRequest;

import java.math.BigDecimal;

/**
 * Immutable state of one run as it moves through the stages. Each stage reads what
 * earlier stages produced and the orchestrator records its output with a wither.
 * Nothing here is shared between runs.
 */
public record PlanRunContext(
    String                traceId,
    PlanRequest           request,
    BigDecimal            equity,
    String                chartDescription,
    AnalystRecommendation analyst,
    TradingSetup          setup,
    RiskAllocation        allocation
) {
    public static PlanRunContext start(String traceId, PlanRequest request, BigDecimal equity) {
        return new PlanRunContext(traceId, request, equity, null, null, null, null);
    }

    public String symbol() {
        return request.symbol();
    }

    public PlanRunContext withAnalyst(AnalystRecommendation analyst, String chartDescription) {
        return new PlanRunContext(traceId, request, equity, chartDescription, analyst, setup, allocation);
    }

    public PlanRunContext withSetup(TradingSetup setup) {
        return new PlanRunContext(traceId, request, equity, chartDescription, analyst, setup, allocation);
    }

    public PlanRunContext withAllocation(RiskAllocation allocation) {
        return new PlanRunContext(traceId, request, equity, chartDescription, analyst, setup, allocation);
    }

    /** Artifacts of the stages completed so far, for failure diagnostics. */
    public StageArtifacts completed() {
        return new StageArtifacts(analyst, setup, allocation);
    }
}
