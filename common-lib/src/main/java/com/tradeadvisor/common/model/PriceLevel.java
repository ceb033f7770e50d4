package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadvisor.common.exception.ValidationException;

import java.math.BigDecimal;

/** A labelled price: support, resistance or target. */
public record PriceLevel(
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("label") String label
) {
    public PriceLevel {
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Price level must be positive. price=" + price, label);
        }
        label = label == null ? "" : label.trim();
    }

    public static PriceLevel of(String price, String label) {
        return new PriceLevel(new BigDecimal(price), label);
    }
}
