package com.tradeadvisor.common.risk;

import com.tradeadvisor.common.exception.InputException;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.ConvictionLevel;
import com.tradeadvisor.common.model.RiskAllocation;
import com.tradeadvisor.common.model.TradingSetup;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Converts a validated setup and a conviction level into a bounded position size.
 *
 * <h3>Formula</h3>
 * <pre>
 *   riskPct          = RiskTable(conviction)            clamped to [0.5 %, 2.0 %]
 *   riskAmount       = equity × riskPct
 *   positionSize     = floor(riskAmount / riskPerShare)
 *   actualRiskAmount = positionSize × riskPerShare       ≤ riskAmount
 * </pre>
 *
 * <p>Pure and deterministic: exact {@link BigDecimal} arithmetic, no clock or I/O, so the
 * same inputs always produce an equal allocation. A size of zero is returned as a valid
 * allocation whose rationale marks the setup as unsizeable.
 */
public final class RiskSizingEngine {

    private RiskSizingEngine() {}

    /**
     * @param setup      validated setup from the trader stage
     * @param conviction analyst conviction driving the risk budget
     * @param equity     account equity, must be positive
     * @param table      conviction → risk mapping
     * @param createdAt  timestamp stamped on the allocation
     * @return {@link RiskAllocation}, never null
     */
    public static RiskAllocation size(TradingSetup setup, ConvictionLevel conviction,
                                      BigDecimal equity, RiskTable table, Instant createdAt) {
        Objects.requireNonNull(setup, "setup");
        Objects.requireNonNull(conviction, "conviction");
        Objects.requireNonNull(table, "table");
        if (equity == null || equity.signum() <= 0) {
            throw new InputException("Equity must be greater than zero. equity=" + equity);
        }

        BigDecimal riskPct      = table.riskPctFor(conviction);
        BigDecimal riskAmount   = equity.multiply(riskPct);
        BigDecimal riskPerShare = setup.riskPerShare();

        long positionSize;
        try {
            positionSize = riskAmount.divide(riskPerShare, 0, RoundingMode.FLOOR).longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Position size exceeds the supported range. riskAmount="
                + riskAmount.toPlainString() + " riskPerShare=" + riskPerShare.toPlainString(), setup);
        }
        BigDecimal size             = BigDecimal.valueOf(positionSize);
        BigDecimal actualRiskAmount = riskPerShare.multiply(size);
        BigDecimal positionValue    = setup.entry().multiply(size);

        String rationale = positionSize == 0
            ? String.format("conviction=%s risk=%s%% budget=%s riskPerShare=%s → size=0. "
                            + "Setup is unsizeable at current risk tolerance: the risk budget "
                            + "is smaller than one unit's risk.",
                            conviction, percent(riskPct), money(riskAmount), riskPerShare.toPlainString())
            : String.format("conviction=%s risk=%s%% budget=%s riskPerShare=%s → size=%d actualRisk=%s",
                            conviction, percent(riskPct), money(riskAmount), riskPerShare.toPlainString(),
                            positionSize, money(actualRiskAmount));

        return new RiskAllocation(setup.symbol(), equity, conviction, riskPct, riskAmount, riskPerShare,
                                  positionSize, actualRiskAmount, positionValue, rationale, createdAt);
    }

    static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
