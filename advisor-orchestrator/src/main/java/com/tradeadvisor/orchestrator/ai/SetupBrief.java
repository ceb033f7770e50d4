package com.tradeadvisor.orchestrator.ai;

import com.tradeadvisor.common.model.AnalystRecommendation;

/** Input to the trader reasoning step: the analyst's call plus the raw chart read. */
public record SetupBrief(
    String                symbol,
    AnalystRecommendation analyst,
    String                chartDescription,
    String                userPrompt
) {
    public SetupBrief {
        userPrompt = userPrompt == null ? "" : userPrompt;
    }
}
