package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.domain.SearchResponse;

/**
 * A provider of live web search results. Implementations wrap one external API and normalize its
 * answer into a {@link SearchResponse}. Adding a provider means adding an implementation and a
 * {@link SearchApi} constant; the research loop does not change.
 */
public interface WebSearchProvider {

  /**
   * Executes one search.
   *
   * @param query the search query
   * @param researchLoopCount completed web-research steps so far (starts at 0)
   * @return normalized results, never {@code null}
   * @throws com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException on network
   *     errors, error statuses or unreadable bodies
   */
  SearchResponse search(String query, int researchLoopCount);

  /** Identifies this provider. */
  SearchApi id();

  /** Token budget per source when formatting this provider's results. */
  int maxTokensPerSource();

  /** Whether formatted evidence includes each source's raw content. */
  boolean includeRawContent();
}
