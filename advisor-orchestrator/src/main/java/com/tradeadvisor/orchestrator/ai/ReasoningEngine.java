package com.tradeadvisor.orchestrator.ai;

import reactor.core.publisher.Mono;

/**
 * Language-model reasoning behind the analyst and trader stages. Implementations
 * return loosely-typed drafts; the stages turn them into validated domain artifacts.
 */
public interface ReasoningEngine {

    Mono<AnalystDraft> analyze(AnalystBrief brief);

    Mono<SetupDraft> planSetup(SetupBrief brief);
}
