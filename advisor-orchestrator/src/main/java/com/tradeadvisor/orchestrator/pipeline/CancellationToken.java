package com.tradeadvisor.orchestrator.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/** Caller-owned cancellation flag, checked by the orchestrator before every stage. */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
