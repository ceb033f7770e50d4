package com.tradeadvisor.orchestrator.capability;

import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw client failures to {@link ExternalServiceException}. Timeouts, connection
 * errors, HTTP 429 and 5xx are transient; everything else is permanent.
 */
public final class ExternalServiceErrors {

    private ExternalServiceErrors() {}

    public static ExternalServiceException classify(Throwable error, ExternalCapability capability) {
        if (error instanceof ExternalServiceException ese) {
            return ese;
        }
        if (error instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            boolean transientFailure = status == 429 || status >= 500;
            return new ExternalServiceException(capability,
                "HTTP " + status + " from provider", transientFailure, error);
        }
        if (error instanceof TimeoutException) {
            return new ExternalServiceException(capability, "Call timed out", true, error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new ExternalServiceException(capability,
                "Connection failed: " + error.getMessage(), true, error);
        }
        return new ExternalServiceException(capability,
            error.getClass().getSimpleName() + ": " + error.getMessage(), false, error);
    }
}
