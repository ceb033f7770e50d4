package com.tradeadvisor.common.plan;

import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.model.FundamentalFactors;
import com.tradeadvisor.common.model.PriceLevel;
import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.model.TechnicalFactors;
import com.tradeadvisor.common.model.TradingSetup;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static com.tradeadvisor.common.plan.PlanFormats.money;
import static com.tradeadvisor.common.plan.PlanFormats.percent;
import static com.tradeadvisor.common.plan.PlanFormats.price;

/**
 * Renders a {@link CompleteTradePlan} as a plain-text report for terminals and the
 * {@code text/plain} endpoint. Sections: status, analyst, setup (if any), risk,
 * executive summary.
 */
public final class TradePlanReportRenderer {

    private static final String RULE = "=".repeat(60);
    private static final String THIN = "-".repeat(60);
    private static final DateTimeFormatter TS =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private TradePlanReportRenderer() {}

    public static String render(CompleteTradePlan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("TRADE PLAN: ").append(plan.symbol()).append('\n').append(RULE).append('\n');
        sb.append(switch (plan.status()) {
            case COMPLETE   -> "TRADE RECOMMENDATION (EXECUTABLE)";
            case UNSIZEABLE -> "TRADE RECOMMENDATION (UNSIZEABLE AT CURRENT RISK TOLERANCE)";
            case NO_TRADE   -> "NO TRADE RECOMMENDATION";
        }).append("\n\n");

        appendAnalyst(sb, plan.analyst());
        if (plan.setup() != null) {
            appendSetup(sb, plan.setup());
        }
        appendRisk(sb, plan.allocation());

        sb.append("EXECUTIVE SUMMARY\n").append(THIN).append('\n')
          .append(plan.executiveSummary()).append("\n\n").append(RULE).append('\n');
        if (plan.createdAt() != null) {
            sb.append("Generated: ").append(TS.format(plan.createdAt())).append('\n');
        }
        return sb.toString();
    }

    private static void appendAnalyst(StringBuilder sb, AnalystRecommendation analyst) {
        sb.append("ANALYST RECOMMENDATION\n").append(THIN).append('\n');
        sb.append("Direction:  ").append(analyst.direction()).append('\n');
        sb.append("Conviction: ").append(analyst.conviction()).append('\n');

        TechnicalFactors tf = analyst.technicalFactors();
        line(sb, "Trend", tf.trend());
        line(sb, "Momentum", tf.momentum());
        line(sb, "Volume", tf.volume());
        line(sb, "Volatility", tf.volatility());
        line(sb, "Patterns", tf.patternNotes());
        if (!tf.keyLevels().isEmpty()) {
            sb.append("Key levels:\n");
            for (PriceLevel level : tf.keyLevels()) {
                sb.append("  ").append(price(level.price()));
                if (!level.label().isEmpty()) sb.append("  ").append(level.label());
                sb.append('\n');
            }
        }

        FundamentalFactors ff = analyst.fundamentalFactors();
        if (ff != null && !ff.isEmpty()) {
            line(sb, "Earnings", ff.earnings());
            line(sb, "Macro", ff.macro());
            line(sb, "News", ff.news());
            line(sb, "Sector", ff.sector());
        }
        if (!analyst.keyObservations().isEmpty()) {
            sb.append("Key observations:\n");
            analyst.keyObservations().forEach(o -> sb.append("  - ").append(o).append('\n'));
        }
        sb.append("\nAnalysis:\n").append(analyst.rationale()).append("\n\n");
    }

    private static void appendSetup(StringBuilder sb, TradingSetup setup) {
        sb.append("TRADING SETUP\n").append(THIN).append('\n');
        sb.append("Direction:      ").append(setup.direction()).append('\n');
        sb.append("Entry:          ").append(price(setup.entry())).append('\n');
        sb.append("Stop loss:      ").append(price(setup.stopLoss())).append('\n');
        for (int i = 0; i < setup.takeProfits().size(); i++) {
            sb.append("Target ").append(i + 1).append(":       ")
              .append(price(setup.takeProfits().get(i))).append('\n');
        }
        sb.append("Risk per unit:  ").append(price(setup.riskPerShare())).append('\n');
        sb.append("Reward:risk:    ").append(setup.rewardToRisk().toPlainString()).append(":1\n");
        sb.append("\nSetup rationale:\n").append(setup.rationale()).append("\n\n");
    }

    private static void appendRisk(StringBuilder sb, RiskAllocation allocation) {
        sb.append("RISK MANAGEMENT & POSITION SIZING\n").append(THIN).append('\n');
        if (allocation == null) {
            sb.append("NO RISK ALLOCATED (NO TRADE)\n\n");
            return;
        }
        sb.append("Account equity: ").append(money(allocation.equity())).append('\n');
        sb.append("Risk budget:    ").append(money(allocation.riskAmount()))
          .append(" (").append(percent(allocation.riskPct())).append(")\n");
        sb.append("Position size:  ").append(allocation.positionSize()).append(" units\n");
        sb.append("Actual risk:    ").append(money(allocation.actualRiskAmount())).append('\n');
        sb.append("Position value: ").append(money(allocation.positionValue())).append('\n');
        sb.append("\nRisk rationale:\n").append(allocation.rationale()).append("\n\n");
    }

    private static void line(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
