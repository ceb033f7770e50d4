package com.tradeadvisor.orchestrator.ai;

/** Text of a page the user referenced in the prompt. */
public record ScrapedPage(String url, String text) {}
