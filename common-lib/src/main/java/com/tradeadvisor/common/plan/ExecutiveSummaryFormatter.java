package com.tradeadvisor.common.plan;

import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.PlanStatus;
import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.model.TradingSetup;

import static com.tradeadvisor.common.plan.PlanFormats.money;
import static com.tradeadvisor.common.plan.PlanFormats.percent;
import static com.tradeadvisor.common.plan.PlanFormats.price;
import static com.tradeadvisor.common.plan.PlanFormats.prices;

/**
 * Builds the one-paragraph executive summary of a plan from its structured fields.
 * Formatting only: every number shown is already present on the artifacts.
 */
public final class ExecutiveSummaryFormatter {

    private ExecutiveSummaryFormatter() {}

    public static String format(PlanStatus status, AnalystRecommendation analyst,
                                TradingSetup setup, RiskAllocation allocation) {
        if (status == PlanStatus.NO_TRADE) {
            return String.format("NO TRADE for %s (conviction %s). Reason: %s",
                analyst.symbol(), analyst.conviction(),
                analyst.rationale().isBlank() ? "no actionable setup identified" : analyst.rationale());
        }

        String levels = String.format("%s %s @ %s | Stop %s | Targets %s | R:R %s",
            setup.direction(), setup.symbol(), price(setup.entry()), price(setup.stopLoss()),
            prices(setup.takeProfits()), setup.rewardToRisk().toPlainString());

        if (status == PlanStatus.UNSIZEABLE) {
            return String.format("%s | Size 0 units: setup is unsizeable at current risk tolerance "
                                 + "(budget %s < risk per unit %s) | Conviction %s",
                levels, money(allocation.riskAmount()), price(allocation.riskPerShare()),
                allocation.conviction());
        }

        return String.format("%s | Size %d units | Risk %s (%s of equity %s) | Conviction %s",
            levels, allocation.positionSize(), money(allocation.actualRiskAmount()),
            percent(allocation.riskPct()), money(allocation.equity()), allocation.conviction());
    }
}
