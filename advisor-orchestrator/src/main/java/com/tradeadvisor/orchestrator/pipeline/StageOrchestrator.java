package com.tradeadvisor.orchestrator.pipeline;

import com.tradeadvisor.common.exception.ErrorKind;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.InputException;
import com.tradeadvisor.common.exception.PipelineException;
import com.tradeadvisor.common.exception.PipelineStage;
import com.tradeadvisor.common.exception.PlannerException;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.model.StageArtifacts;
import com.tradeadvisor.common.plan.PlanAssembler;
import com.tradeadvisor.common.trace.TraceContextUtil;
import com.tradeadvisor.orchestrator.capability.AccountInfoProvider;
import com.tradeadvisor.orchestrator.logger.PipelineFlowLogger;
import com.tradeadvisor.orchestrator.stage.AnalystStage;
import com.tradeadvisor.orchestrator.stage.PlanRunContext;
import com.tradeadvisor.orchestrator.stage.RiskStage;
import com.tradeadvisor.orchestrator.stage.StageRetryPolicy;
import com.tradeadvisor.orchestrator.stage.TraderStage;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Drives one trade-plan run through its stages, strictly in order.
 *
 * <pre>
 *   INPUT → ANALYST ─┬─ NO_TRADE ───────────────→ ASSEMBLER
 *                    └─ LONG/SHORT → TRADER → RISK → ASSEMBLER
 * </pre>
 *
 * <p>The cancellation token is checked before every stage. Any failure aborts the run
 * with a {@link PipelineException} naming the stage and carrying whatever artifacts
 * had already been produced. The orchestrator itself never retries; retries of
 * transient capability failures happen inside the stages.
 */
@Component
public class StageOrchestrator {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("[A-Z0-9.^=:/-]{1,20}");

    private final AccountInfoProvider accountInfoProvider;
    private final AnalystStage analystStage;
    private final TraderStage traderStage;
    private final RiskStage riskStage;
    private final StageRetryPolicy retryPolicy;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;

    public StageOrchestrator(AccountInfoProvider accountInfoProvider,
                             AnalystStage analystStage,
                             TraderStage traderStage,
                             RiskStage riskStage,
                             StageRetryPolicy retryPolicy,
                             PipelineFlowLogger flowLogger,
                             Clock clock) {
        this.accountInfoProvider = accountInfoProvider;
        this.analystStage = analystStage;
        this.traderStage = traderStage;
        this.riskStage = riskStage;
        this.retryPolicy = retryPolicy;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    public Mono<CompleteTradePlan> run(PlanRequest request, CancellationToken token) {
        String traceId = TraceContextUtil.newTraceId();

        Mono<CompleteTradePlan> pipeline = Mono.fromRunnable(
                () -> flowLogger.logWithTraceId(PipelineFlowLogger.RUN_STARTED, request.symbol(), traceId))
            .then(runStage(PipelineStage.INPUT, PlanRunContext.start(traceId, request, null), token,
                           this::resolveInput))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.INPUT_RESOLVED))
            .flatMap(ctx -> runStage(PipelineStage.ANALYST, ctx, token,
                c -> analystStage.execute(c).map(f -> c.withAnalyst(f.recommendation(), f.chartDescription()))))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.ANALYST_COMPLETED))
            .flatMap(ctx -> ctx.analyst().isActionable()
                ? tradeAndSize(ctx, token)
                : shortCircuit(ctx))
            .flatMap(ctx -> runStage(PipelineStage.ASSEMBLER, ctx, token,
                c -> Mono.fromCallable(() -> PlanAssembler.assemble(
                    c.analyst(), c.setup(), c.allocation(), clock.instant()))))
            .doOnNext(plan -> flowLogger.logPlan(plan, traceId))
            .doOnError(PipelineException.class, flowLogger::logFailure);

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private Mono<PlanRunContext> tradeAndSize(PlanRunContext ctx, CancellationToken token) {
        return runStage(PipelineStage.TRADER, ctx, token, c -> traderStage.execute(c).map(c::withSetup))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.TRADER_COMPLETED))
            .flatMap(c -> runStage(PipelineStage.RISK, c, token, r -> riskStage.execute(r).map(r::withAllocation)))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.RISK_COMPLETED));
    }

    private Mono<PlanRunContext> shortCircuit(PlanRunContext ctx) {
        flowLogger.logWithTraceId(PipelineFlowLogger.SHORT_CIRCUIT, ctx.symbol(), ctx.traceId());
        return Mono.just(ctx);
    }

    private Mono<PlanRunContext> resolveInput(PlanRunContext ctx) {
        PlanRequest request = ctx.request();
        if (request.chart() == null) {
            throw new InputException("Chart image is required");
        }
        request.chart().validate();
        if (request.symbol().isBlank()) {
            throw new InputException("Symbol is required");
        }
        if (!SYMBOL_PATTERN.matcher(request.symbol()).matches()) {
            throw new InputException("Symbol is malformed. symbol=" + request.symbol());
        }
        return retryPolicy.apply(Mono.defer(() -> accountInfoProvider.getEquity(request.equity())),
                                 ExternalCapability.ACCOUNT, ctx.traceId())
            .map(equity -> PlanRunContext.start(ctx.traceId(), request, equity));
    }

    /**
     * Checks cancellation, then runs {@code body} and converts any failure into a
     * {@link PipelineException} for {@code stage}. Synchronous throws from the body are
     * treated the same as error signals.
     */
    private <T> Mono<T> runStage(PipelineStage stage, PlanRunContext ctx, CancellationToken token,
                                 Function<PlanRunContext, Mono<T>> body) {
        return Mono.defer(() -> {
                if (token.isCancelled()) {
                    return Mono.error(PipelineException.cancelled(stage, ctx.traceId(), ctx.completed()));
                }
                return body.apply(ctx);
            })
            .onErrorMap(e -> !(e instanceof PipelineException), e -> toPipelineException(stage, e, ctx));
    }

    private static PipelineException toPipelineException(PipelineStage stage, Throwable error, PlanRunContext ctx) {
        StageArtifacts completed = ctx.completed();
        if (error instanceof PlannerException pe) {
            return PipelineException.fromStage(stage, pe, ctx.traceId(), completed);
        }
        return new PipelineException(stage, ErrorKind.EXTERNAL_SERVICE, null, ctx.traceId(), completed,
            "Unexpected failure: " + error.getClass().getSimpleName() + ": " + error.getMessage(), error);
    }
}
