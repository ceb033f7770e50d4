package com.tradeadvisor.orchestrator.controller;

import com.tradeadvisor.common.exception.ErrorKind;
import com.tradeadvisor.common.exception.PipelineException;
import com.tradeadvisor.common.exception.PipelineStage;
import com.tradeadvisor.common.exception.PlannerException;
import com.tradeadvisor.common.model.StageArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps run failures to HTTP: INPUT 400, VALIDATION 422, EXTERNAL_SERVICE 502,
 * CANCELLED 409.
 */
@RestControllerAdvice
public class TradePlanExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TradePlanExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<PlanErrorResponse> handlePipelineException(PipelineException ex) {
        log.warn("[TradePlanApi] Run failed. stage={} kind={} traceId={}", ex.getStage(), ex.getKind(), ex.getTraceId());
        return ResponseEntity.status(statusFor(ex.getKind()))
            .body(new PlanErrorResponse(ex.getStage(), ex.getKind(), ex.getCapability(),
                                        ex.getMessage(), ex.getTraceId(), ex.getCompleted()));
    }

    /** Request rejected before a run was started, e.g. an unparseable equity field. */
    @ExceptionHandler(PlannerException.class)
    public ResponseEntity<PlanErrorResponse> handlePlannerException(PlannerException ex) {
        log.warn("[TradePlanApi] Request rejected. kind={} reason={}", ex.kind(), ex.getMessage());
        return ResponseEntity.status(statusFor(ex.kind()))
            .body(new PlanErrorResponse(PipelineStage.INPUT, ex.kind(), null,
                                        ex.getMessage(), null, StageArtifacts.empty()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INPUT            -> HttpStatus.BAD_REQUEST;
            case VALIDATION       -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL_SERVICE -> HttpStatus.BAD_GATEWAY;
            case CANCELLED        -> HttpStatus.CONFLICT;
        };
    }
}
