package com.tradeadvisor.orchestrator.ai;

import com.tradeadvisor.orchestrator.capability.SearchResult;

import java.util.List;

/** Everything the analyst reasoning step sees. Lists are never null. */
public record AnalystBrief(
    String            symbol,
    String            chartDescription,
    List<SearchResult> news,
    List<ScrapedPage> pages,
    String            userPrompt
) {
    public AnalystBrief {
        news  = news  == null ? List.of() : List.copyOf(news);
        pages = pages == null ? List.of() : List.copyOf(pages);
        userPrompt = userPrompt == null ? "" : userPrompt;
    }

    public boolean hasResearch() {
        return !news.isEmpty() || !pages.isEmpty();
    }
}
