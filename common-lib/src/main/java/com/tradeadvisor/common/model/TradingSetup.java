package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Concrete price-level setup produced by the trader stage.
 *
 * <h3>Ordering invariant</h3>
 * <pre>
 *   LONG  : stopLoss &lt; entry &lt; takeProfits[0] &lt; takeProfits[1] &lt; ...
 *   SHORT : stopLoss &gt; entry &gt; takeProfits[0] &gt; takeProfits[1] &gt; ...
 * </pre>
 * A setup that breaks the ordering is rejected, never reordered. {@code riskPerShare}
 * is always {@code |entry - stopLoss|}; use {@link #of} so it is computed rather than
 * supplied.
 */
public record TradingSetup(
    @JsonProperty("symbol")       String           symbol,
    @JsonProperty("direction")    TradeDirection   direction,
    @JsonProperty("entry")        BigDecimal       entry,
    @JsonProperty("stopLoss")     BigDecimal       stopLoss,
    @JsonProperty("takeProfits")  List<BigDecimal> takeProfits,
    @JsonProperty("riskPerShare") BigDecimal       riskPerShare,
    @JsonProperty("rationale")    String           rationale,
    @JsonProperty("createdAt")    Instant          createdAt
) {
    public TradingSetup {
        if (direction == null || !direction.isActionable()) {
            throw new ValidationException("Setup direction must be LONG or SHORT. direction=" + direction,
                describe(direction, entry, stopLoss, takeProfits));
        }
        if (entry == null || entry.signum() <= 0 || stopLoss == null || stopLoss.signum() <= 0) {
            throw new ValidationException("Entry and stop loss must be positive prices",
                describe(direction, entry, stopLoss, takeProfits));
        }
        if (takeProfits == null || takeProfits.isEmpty()) {
            throw new ValidationException("Setup needs at least one take-profit target",
                describe(direction, entry, stopLoss, takeProfits));
        }
        if (takeProfits.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("Take-profit targets must not contain blanks",
                describe(direction, entry, stopLoss, takeProfits));
        }
        takeProfits = List.copyOf(takeProfits);
        checkOrdering(direction, entry, stopLoss, takeProfits);

        BigDecimal expectedRisk = entry.subtract(stopLoss).abs();
        if (riskPerShare == null || riskPerShare.compareTo(expectedRisk) != 0) {
            throw new ValidationException("Risk per share must equal |entry - stopLoss|. expected="
                + expectedRisk.toPlainString() + " actual=" + riskPerShare,
                describe(direction, entry, stopLoss, takeProfits));
        }
        if (createdAt == null) {
            throw new ValidationException("Setup has no creation timestamp", symbol);
        }
        rationale = rationale == null ? "" : rationale;
    }

    /** Builds a setup with {@code riskPerShare} derived from entry and stop. */
    public static TradingSetup of(String symbol, TradeDirection direction, BigDecimal entry,
                                  BigDecimal stopLoss, List<BigDecimal> takeProfits,
                                  String rationale, Instant createdAt) {
        BigDecimal riskPerShare = (entry != null && stopLoss != null) ? entry.subtract(stopLoss).abs() : null;
        return new TradingSetup(symbol, direction, entry, stopLoss, takeProfits, riskPerShare,
                                rationale, createdAt);
    }

    /** Reward to risk of the first target, rounded half-up to two decimals. */
    @JsonProperty("rewardToRisk")
    public BigDecimal rewardToRisk() {
        return takeProfits.get(0).subtract(entry).abs().divide(riskPerShare, 2, RoundingMode.HALF_UP);
    }

    private static void checkOrdering(TradeDirection direction, BigDecimal entry,
                                      BigDecimal stopLoss, List<BigDecimal> takeProfits) {
        // sign +1: prices must rise along stop -> entry -> targets; -1: they must fall
        int sign = direction == TradeDirection.LONG ? 1 : -1;
        BigDecimal previous = stopLoss;
        String previousName = "stopLoss";
        for (int i = -1; i < takeProfits.size(); i++) {
            BigDecimal current = i < 0 ? entry : takeProfits.get(i);
            String currentName = i < 0 ? "entry" : "takeProfits[" + i + "]";
            if (current.signum() <= 0) {
                throw new ValidationException(currentName + " must be a positive price",
                    describe(direction, entry, stopLoss, takeProfits));
            }
            if (current.compareTo(previous) * sign <= 0) {
                throw new ValidationException(String.format(
                    "Price ordering violated for %s setup: %s=%s must be %s %s=%s",
                    direction, currentName, current.toPlainString(),
                    sign > 0 ? "above" : "below", previousName, previous.toPlainString()),
                    describe(direction, entry, stopLoss, takeProfits));
            }
            previous = current;
            previousName = currentName;
        }
    }

    private static String describe(TradeDirection direction, BigDecimal entry,
                                   BigDecimal stopLoss, List<BigDecimal> takeProfits) {
        return "direction=" + direction + " entry=" + entry + " stopLoss=" + stopLoss
            + " takeProfits=" + takeProfits;
    }
}
