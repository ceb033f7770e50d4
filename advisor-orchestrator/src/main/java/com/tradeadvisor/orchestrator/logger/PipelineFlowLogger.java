package com.tradeadvisor.orchestrator.logger;

import com.tradeadvisor.common.exception.PipelineException;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.model.StageArtifacts;
import com.tradeadvisor.common.trace.TraceContextUtil;
import com.tradeadvisor.orchestrator.stage.PlanRunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for a trade-plan run. Side effects only.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}       request accepted, trace id assigned</li>
 *   <li>{@link #INPUT_RESOLVED}    inputs validated, equity resolved</li>
 *   <li>{@link #ANALYST_COMPLETED} recommendation produced</li>
 *   <li>{@link #SHORT_CIRCUIT}     NO_TRADE: trader and risk skipped</li>
 *   <li>{@link #TRADER_COMPLETED}  setup produced</li>
 *   <li>{@link #RISK_COMPLETED}    allocation produced</li>
 *   <li>{@link #PLAN_ASSEMBLED}    final plan built</li>
 *   <li>{@link #RUN_FAILED}        terminal failure</li>
 * </ol>
 *
 * <p>Stage transitions inside the run are logged with {@link #stage}, which reads the
 * trace id from the Reactor Context rather than from the run context.
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_STARTED       = "RUN_STARTED";
    public static final String INPUT_RESOLVED    = "INPUT_RESOLVED";
    public static final String ANALYST_COMPLETED = "ANALYST_COMPLETED";
    public static final String SHORT_CIRCUIT     = "SHORT_CIRCUIT";
    public static final String TRADER_COMPLETED  = "TRADER_COMPLETED";
    public static final String RISK_COMPLETED    = "RISK_COMPLETED";
    public static final String PLAN_ASSEMBLED    = "PLAN_ASSEMBLED";
    public static final String RUN_FAILED        = "RUN_FAILED";

    /** {@code doOnEach} consumer: logs {@code stageName} for each completed run context. */
    public Consumer<Signal<PlanRunContext>> stage(String stageName) {
        return signal -> {
            PlanRunContext ctx = signal.get();
            if (!signal.isOnNext() || ctx == null) return;
            logWithTraceId(stageName, ctx.symbol(), TraceContextUtil.getTraceId(signal.getContextView()));
        };
    }

    public void logWithTraceId(String stageName, String symbol, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} symbol={} traceId={}", stageName, symbol, traceId)
        );
    }

    public void logPlan(CompleteTradePlan plan, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} symbol={} status={} executable={} traceId={}",
                     PLAN_ASSEMBLED, plan.symbol(), plan.status(), plan.isExecutable(), traceId)
        );
    }

    public void logFailure(PipelineException failure) {
        TraceContextUtil.withMdc(failure.getTraceId(), () ->
            log.error("[PipelineFlow] stage={} failedStage={} kind={} capability={} completed={} reason={} traceId={}",
                      RUN_FAILED, failure.getStage(), failure.getKind(),
                      failure.getCapability() != null ? failure.getCapability() : "N/A",
                      failure.getCompleted().isEmpty() ? "none" : describe(failure),
                      failure.getMessage(), failure.getTraceId())
        );
    }

    private static String describe(PipelineException failure) {
        StageArtifacts c = failure.getCompleted();
        StringBuilder sb = new StringBuilder();
        if (c.analyst() != null)    sb.append("analyst ");
        if (c.setup() != null)      sb.append("setup ");
        if (c.allocation() != null) sb.append("allocation");
        return sb.toString().trim();
    }
}
