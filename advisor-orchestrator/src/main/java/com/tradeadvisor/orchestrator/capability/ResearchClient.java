package com.tradeadvisor.orchestrator.capability;

import reactor.core.publisher.Mono;

import java.util.List;

/** Recent-news search and single-page scraping. */
public interface ResearchClient {

    /** Recent news for {@code query}, most relevant first. Empty list when nothing matched. */
    Mono<List<SearchResult>> search(String query);

    /** Readable text of the page at {@code url}. */
    Mono<String> scrape(String url);
}
