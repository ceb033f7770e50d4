package com.tradeadvisor.common.plan;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/** Locale-independent number formatting shared by the summary and the report. */
final class PlanFormats {

    private PlanFormats() {}

    /** Prices keep their own precision but always show at least two decimals. */
    static String price(BigDecimal value) {
        return value.scale() < 2 ? value.setScale(2, RoundingMode.UNNECESSARY).toPlainString()
                                 : value.toPlainString();
    }

    static String prices(List<BigDecimal> values) {
        return values.stream().map(PlanFormats::price).collect(Collectors.joining(", "));
    }

    static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
