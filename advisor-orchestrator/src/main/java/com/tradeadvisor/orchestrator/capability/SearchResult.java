package com.tradeadvisor.orchestrator.capability;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One news hit returned by {@link ResearchClient#search}. */
public record SearchResult(
    @JsonProperty("title")   String title,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("source")  String source,
    @JsonProperty("date")    String date,
    @JsonProperty("link")    String link
) {}
