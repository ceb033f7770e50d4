package com.tradeadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.stream.Stream;

/** Fundamental and macro context gathered from research. All fields optional. */
public record FundamentalFactors(
    @JsonProperty("earnings") String earnings,
    @JsonProperty("macro")    String macro,
    @JsonProperty("news")     String news,
    @JsonProperty("sector")   String sector
) {
    @JsonIgnore
    public boolean isEmpty() {
        return Stream.of(earnings, macro, news, sector).allMatch(s -> s == null || s.isBlank());
    }
}
