package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.TradingSetup;
import com.tradeadvisor.orchestrator.ai.ReasoningEngine;
import com.tradeadvisor.orchestrator.ai.SetupBrief;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Second stage: turns an actionable recommendation into entry, stop and targets.
 * The setup must keep the analyst's direction and the directional price ordering.
 */
@Component
public class TraderStage {

    private static final Logger log = LoggerFactory.getLogger(TraderStage.class);

    private final ReasoningEngine reasoningEngine;
    private final StageRetryPolicy retryPolicy;
    private final Clock clock;

    public TraderStage(ReasoningEngine reasoningEngine, StageRetryPolicy retryPolicy, Clock clock) {
        this.reasoningEngine = reasoningEngine;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /** @throws IllegalStateException when called for a NO_TRADE recommendation */
    public Mono<TradingSetup> execute(PlanRunContext ctx) {
        AnalystRecommendation analyst = ctx.analyst();
        if (analyst == null || !analyst.isActionable()) {
            throw new IllegalStateException("Trader stage requires an actionable recommendation. symbol="
                + ctx.symbol());
        }
        SetupBrief brief = new SetupBrief(ctx.symbol(), analyst, ctx.chartDescription(), ctx.request().prompt());

        return retryPolicy.apply(Mono.defer(() -> reasoningEngine.planSetup(brief)),
                                 ExternalCapability.REASONING, ctx.traceId())
            .switchIfEmpty(Mono.error(() -> new ValidationException("Reasoning returned no setup draft", brief)))
            .map(draft -> {
                TradingSetup setup = draft.toSetup(ctx.symbol(), clock.instant());
                if (setup.direction() != analyst.direction()) {
                    throw new ValidationException("Setup direction " + setup.direction()
                        + " contradicts analyst direction " + analyst.direction(), setup);
                }
                return setup;
            })
            .doOnSuccess(s -> log.info("[TraderStage] Setup ready. symbol={} direction={} entry={} stop={} targets={} traceId={}",
                                       s.symbol(), s.direction(), s.entry(), s.stopLoss(),
                                       s.takeProfits().size(), ctx.traceId()));
    }
}
