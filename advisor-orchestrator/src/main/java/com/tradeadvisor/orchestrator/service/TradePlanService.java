package com.tradeadvisor.orchestrator.service;

import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.plan.TradePlanReportRenderer;
import com.tradeadvisor.orchestrator.capability.ChartImage;
import com.tradeadvisor.orchestrator.pipeline.CancellationToken;
import com.tradeadvisor.orchestrator.pipeline.PlanRequest;
import com.tradeadvisor.orchestrator.pipeline.StageOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/** Caller-facing entry point: one submission, one run. */
@Service
public class TradePlanService {

    private static final Logger log = LoggerFactory.getLogger(TradePlanService.class);

    private final StageOrchestrator orchestrator;

    public TradePlanService(StageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Mono<CompleteTradePlan> submit(ChartImage chart, String symbol, BigDecimal equity,
                                          String prompt, CancellationToken token) {
        log.info("[TradePlanService] Submission received. symbol={} chart={}", symbol, chart);
        return orchestrator.run(new PlanRequest(chart, symbol, equity, prompt), token);
    }

    /** Same run as {@link #submit}, rendered as a plain-text report. */
    public Mono<String> submitForReport(ChartImage chart, String symbol, BigDecimal equity,
                                        String prompt, CancellationToken token) {
        return submit(chart, symbol, equity, prompt, token).map(TradePlanReportRenderer::render);
    }
}
