package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Position size produced by the risk stage.
 *
 * <pre>
 *   riskAmount       = equity × riskPct
 *   positionSize     = floor(riskAmount / riskPerShare)
 *   actualRiskAmount = positionSize × riskPerShare      (≤ riskAmount)
 *   positionValue    = positionSize × entry
 * </pre>
 *
 * <p>{@code positionSize == 0} is a valid allocation: the setup cannot be sized at the
 * current risk tolerance. Callers decide whether to present that as no trade.
 */
public record RiskAllocation(
    @JsonProperty("symbol")           String          symbol,
    @JsonProperty("equity")           BigDecimal      equity,
    @JsonProperty("conviction")       ConvictionLevel conviction,
    @JsonProperty("riskPct")          BigDecimal      riskPct,
    @JsonProperty("riskAmount")       BigDecimal      riskAmount,
    @JsonProperty("riskPerShare")     BigDecimal      riskPerShare,
    @JsonProperty("positionSize")     long            positionSize,
    @JsonProperty("actualRiskAmount") BigDecimal      actualRiskAmount,
    @JsonProperty("positionValue")    BigDecimal      positionValue,
    @JsonProperty("rationale")        String          rationale,
    @JsonProperty("createdAt")        Instant         createdAt
) {
    /** Lower bound of the per-trade risk budget, as a fraction of equity (0.5 %). */
    public static final BigDecimal MIN_RISK_PCT = new BigDecimal("0.005");

    /** Upper bound of the per-trade risk budget, as a fraction of equity (2.0 %). */
    public static final BigDecimal MAX_RISK_PCT = new BigDecimal("0.02");

    public RiskAllocation {
        if (equity == null || equity.signum() <= 0) {
            throw new ValidationException("Equity must be positive. equity=" + equity, symbol);
        }
        if (conviction == null) {
            throw new ValidationException("Allocation has no conviction", symbol);
        }
        if (riskPct == null || riskPct.compareTo(MIN_RISK_PCT) < 0 || riskPct.compareTo(MAX_RISK_PCT) > 0) {
            throw new ValidationException("Risk percentage outside [0.005, 0.02]. riskPct=" + riskPct, symbol);
        }
        if (riskAmount == null || riskAmount.compareTo(equity.multiply(riskPct)) != 0) {
            throw new ValidationException("Risk amount must equal equity × riskPct. riskAmount=" + riskAmount, symbol);
        }
        if (riskPerShare == null || riskPerShare.signum() <= 0) {
            throw new ValidationException("Risk per share must be positive. riskPerShare=" + riskPerShare, symbol);
        }
        if (positionSize < 0) {
            throw new ValidationException("Position size must not be negative. positionSize=" + positionSize, symbol);
        }
        if (actualRiskAmount == null
                || actualRiskAmount.compareTo(riskPerShare.multiply(BigDecimal.valueOf(positionSize))) != 0) {
            throw new ValidationException("Actual risk must equal positionSize × riskPerShare", symbol);
        }
        if (actualRiskAmount.compareTo(riskAmount) > 0) {
            throw new ValidationException("Actual risk " + actualRiskAmount.toPlainString()
                + " exceeds budget " + riskAmount.toPlainString(), symbol);
        }
        if (positionValue == null || positionValue.signum() < 0) {
            throw new ValidationException("Position value must not be negative", symbol);
        }
        if (createdAt == null) {
            throw new ValidationException("Allocation has no creation timestamp", symbol);
        }
        rationale = rationale == null ? "" : rationale;
    }

    public boolean isSizeable() {
        return positionSize > 0;
    }
}
