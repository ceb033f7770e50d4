package com.tradeadvisor.orchestrator.capability;

import reactor.core.publisher.Mono;

/** Turns a chart image into a textual description of what it shows. */
public interface VisionAnalyzer {

    /**
     * @param chart        validated chart upload
     * @param instructions what to look for (trend, levels, patterns, indicators)
     * @return free-text description; fails with
     *         {@link com.tradeadvisor.common.exception.ExternalServiceException} on provider errors
     */
    Mono<String> analyze(ChartImage chart, String instructions);
}
