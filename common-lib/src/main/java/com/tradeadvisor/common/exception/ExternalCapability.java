package com.tradeadvisor.common.exception;

/** External capabilities the pipeline calls out to. */
public enum ExternalCapability {
    VISION,
    SEARCH,
    SCRAPE,
    ACCOUNT,
    REASONING
}
