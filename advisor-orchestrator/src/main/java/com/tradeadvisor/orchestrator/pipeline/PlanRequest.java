package com.tradeadvisor.orchestrator.pipeline;

import com.tradeadvisor.orchestrator.capability.ChartImage;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One trade-plan request as received from the caller. Not validated here: the
 * orchestrator's input step rejects bad values with an INPUT failure.
 */
public record PlanRequest(
    ChartImage chart,
    String     symbol,
    BigDecimal equity,
    String     prompt
) {
    public PlanRequest {
        symbol = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        prompt = prompt == null ? "" : prompt.trim();
    }
}
