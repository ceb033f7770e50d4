package com.tradeadvisor.orchestrator.capability;

import com.tradeadvisor.common.exception.InputException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Uses the equity supplied with the request. There is no brokerage connection, so a
 * missing or non-positive value is an input error.
 */
@Component
public class ExplicitAccountInfoProvider implements AccountInfoProvider {

    @Override
    public Mono<BigDecimal> getEquity(BigDecimal requested) {
        if (requested == null) {
            return Mono.error(new InputException("Account equity is required"));
        }
        if (requested.signum() <= 0) {
            return Mono.error(new InputException(
                "Account equity must be positive. equity=" + requested.toPlainString()));
        }
        return Mono.just(requested);
    }
}
