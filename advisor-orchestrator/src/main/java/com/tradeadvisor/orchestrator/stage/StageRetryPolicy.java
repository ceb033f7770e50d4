package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.common.exception.PlannerException;
import com.tradeadvisor.orchestrator.capability.ExternalServiceErrors;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded exponential-backoff retry around a single capability call.
 *
 * <p>Only transient {@link ExternalServiceException}s are retried. Input and validation
 * failures, and permanent provider errors, pass straight through. When the budget is
 * spent the last failure is propagated unchanged.
 */
@Component
public class StageRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(StageRetryPolicy.class);

    private final PlannerProperties.Retry settings;

    public StageRetryPolicy(PlannerProperties properties) {
        this.settings = properties.retry();
    }

    /**
     * @param call       a lazy call; it is re-subscribed on each attempt
     * @param capability used to tag unclassified failures
     */
    public <T> Mono<T> apply(Mono<T> call, ExternalCapability capability, String traceId) {
        return call
            .onErrorMap(e -> !(e instanceof PlannerException), e -> ExternalServiceErrors.classify(e, capability))
            .retryWhen(Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
                .filter(StageRetryPolicy::isRetryable)
                .doBeforeRetry(signal -> log.warn(
                    "[Retry] Transient failure, retrying. capability={} attempt={} reason={} traceId={}",
                    capability, signal.totalRetries() + 2, signal.failure().getMessage(), traceId))
                .onRetryExhaustedThrow((backoffSpec, signal) -> signal.failure()));
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof ExternalServiceException ese && ese.isTransient();
    }
}
