package com.tradeadvisor.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ErrorKind;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.PipelineStage;
import com.tradeadvisor.common.model.StageArtifacts;

/** JSON body of a failed run. {@code capability} and {@code traceId} may be null. */
public record PlanErrorResponse(
    @JsonProperty("stage")      PipelineStage      stage,
    @JsonProperty("kind")       ErrorKind          kind,
    @JsonProperty("capability") ExternalCapability capability,
    @JsonProperty("message")    String             message,
    @JsonProperty("traceId")    String             traceId,
    @JsonProperty("completed")  StageArtifacts     completed
) {}
