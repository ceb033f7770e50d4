package com.tradeadvisor.common.risk;

import com.tradeadvisor.common.model.ConvictionLevel;
import com.tradeadvisor.common.model.RiskAllocation;

import java.math.BigDecimal;

/**
 * Discrete conviction → risk-percentage table.
 *
 * <p>Configured values are not trusted as-is: every entry is clamped to
 * [{@link RiskAllocation#MIN_RISK_PCT}, {@link RiskAllocation#MAX_RISK_PCT}] and a level
 * never resolves below the level beneath it, so the mapping stays bounded and monotonic
 * whatever the configuration says.
 *
 * @param lowPct    fraction of equity risked on LOW conviction (default 0.005)
 * @param mediumPct fraction of equity risked on MEDIUM conviction (default 0.01)
 * @param highPct   fraction of equity risked on HIGH conviction (default 0.02)
 */
public record RiskTable(BigDecimal lowPct, BigDecimal mediumPct, BigDecimal highPct) {

    public static final BigDecimal DEFAULT_LOW_PCT    = new BigDecimal("0.005");
    public static final BigDecimal DEFAULT_MEDIUM_PCT = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_HIGH_PCT   = new BigDecimal("0.02");

    public RiskTable {
        lowPct    = lowPct    != null ? lowPct    : DEFAULT_LOW_PCT;
        mediumPct = mediumPct != null ? mediumPct : DEFAULT_MEDIUM_PCT;
        highPct   = highPct   != null ? highPct   : DEFAULT_HIGH_PCT;
    }

    public static RiskTable defaults() {
        return new RiskTable(DEFAULT_LOW_PCT, DEFAULT_MEDIUM_PCT, DEFAULT_HIGH_PCT);
    }

    /** Resolved, clamped and monotonic risk fraction for the given conviction. */
    public BigDecimal riskPctFor(ConvictionLevel conviction) {
        BigDecimal low = clamp(lowPct);
        if (conviction == ConvictionLevel.LOW) return low;
        BigDecimal medium = clamp(mediumPct).max(low);
        if (conviction == ConvictionLevel.MEDIUM) return medium;
        return clamp(highPct).max(medium);
    }

    static BigDecimal clamp(BigDecimal pct) {
        return pct.max(RiskAllocation.MIN_RISK_PCT).min(RiskAllocation.MAX_RISK_PCT);
    }
}
