package com.tradeadvisor.orchestrator.capability;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/** Source of the account equity a plan is sized against. */
public interface AccountInfoProvider {

    /**
     * Resolves account equity.
     *
     * @param requested equity supplied with the request, possibly null
     * @return strictly positive equity; fails with
     *         {@link com.tradeadvisor.common.exception.InputException} otherwise
     */
    Mono<BigDecimal> getEquity(BigDecimal requested);
}
