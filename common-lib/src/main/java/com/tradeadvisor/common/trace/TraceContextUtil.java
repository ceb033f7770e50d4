package com.tradeadvisor.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Per-run trace id propagation for reactive pipelines.
 *
 * <p>The Reactor Context holds the trace id of a run. MDC is written only around a
 * single log statement ({@link #withMdc}) and cleared immediately, because a reactive
 * run hops threads between stages and a ThreadLocal would leak into other runs.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    /** Fresh trace id for a new run. */
    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Stores {@code traceId} in the subscriber context of {@code mono}. Call at assembly end. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from a {@link ContextView}, or {@value #UNKNOWN}; never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with {@code traceId} bridged into MDC, then removes it. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
