package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.model.AnalystRecommendation;

/** Analyst stage output: the recommendation plus the chart read it was based on. */
public record AnalystFindings(AnalystRecommendation recommendation, String chartDescription) {}
