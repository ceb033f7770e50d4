package com.tradeadvisor.common.plan;

import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.model.PlanStatus;
import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.model.StageArtifacts;
import com.tradeadvisor.common.model.TradingSetup;

import java.time.Instant;
import java.util.Objects;

/**
 * Merges the stage artifacts of one run into a {@link CompleteTradePlan}.
 *
 * <h3>Cross-stage checks (fail closed)</h3>
 * <ol>
 *   <li>setup and allocation both present or both absent</li>
 *   <li>present exactly when the analyst direction is LONG or SHORT</li>
 *   <li>setup direction equals analyst direction</li>
 *   <li>all artifacts name the same symbol</li>
 *   <li>allocation was sized against the setup's risk per share</li>
 * </ol>
 * Any violation raises {@link ValidationException} carrying the artifacts; an
 * inconsistent plan is never emitted.
 */
public final class PlanAssembler {

    private PlanAssembler() {}

    public static CompleteTradePlan assemble(AnalystRecommendation analyst, TradingSetup setup,
                                             RiskAllocation allocation, Instant createdAt) {
        Objects.requireNonNull(analyst, "analyst");
        StageArtifacts artifacts = new StageArtifacts(analyst, setup, allocation);

        if ((setup == null) != (allocation == null)) {
            throw new ValidationException("Setup and allocation must be both present or both absent", artifacts);
        }
        if (!analyst.isActionable()) {
            if (setup != null) {
                throw new ValidationException("NO_TRADE recommendation must not carry a setup", artifacts);
            }
            return build(PlanStatus.NO_TRADE, analyst, null, null, createdAt);
        }
        if (setup == null) {
            throw new ValidationException(analyst.direction() + " recommendation is missing its setup", artifacts);
        }
        if (setup.direction() != analyst.direction()) {
            throw new ValidationException("Setup direction " + setup.direction()
                + " contradicts analyst direction " + analyst.direction(), artifacts);
        }
        if (!analyst.symbol().equals(setup.symbol()) || !analyst.symbol().equals(allocation.symbol())) {
            throw new ValidationException("Artifacts disagree on symbol", artifacts);
        }
        if (allocation.riskPerShare().compareTo(setup.riskPerShare()) != 0) {
            throw new ValidationException("Allocation was sized against a different risk per share", artifacts);
        }

        PlanStatus status = allocation.isSizeable() ? PlanStatus.COMPLETE : PlanStatus.UNSIZEABLE;
        return build(status, analyst, setup, allocation, createdAt);
    }

    private static CompleteTradePlan build(PlanStatus status, AnalystRecommendation analyst,
                                           TradingSetup setup, RiskAllocation allocation,
                                           Instant createdAt) {
        String summary = ExecutiveSummaryFormatter.format(status, analyst, setup, allocation);
        return new CompleteTradePlan(analyst.symbol(), status, analyst, setup, allocation, summary, createdAt);
    }
}
