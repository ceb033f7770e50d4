package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.risk.RiskSizingEngine;
import com.tradeadvisor.common.risk.RiskTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/** Third stage: sizes the setup against account equity. Pure computation, no I/O. */
@Component
public class RiskStage {

    private static final Logger log = LoggerFactory.getLogger(RiskStage.class);

    private final RiskTable riskTable;
    private final Clock clock;

    public RiskStage(RiskTable riskTable, Clock clock) {
        this.riskTable = riskTable;
        this.clock = clock;
    }

    public Mono<RiskAllocation> execute(PlanRunContext ctx) {
        return Mono.fromCallable(() -> RiskSizingEngine.size(
                ctx.setup(), ctx.analyst().conviction(), ctx.equity(), riskTable, clock.instant()))
            .doOnSuccess(a -> log.info("[RiskStage] Position sized. symbol={} riskPct={} size={} actualRisk={} traceId={}",
                                       a.symbol(), a.riskPct(), a.positionSize(), a.actualRiskAmount(),
                                       ctx.traceId()));
    }
}
