package com.flamingo.ai.deepresearch.domain;

import java.util.List;

/** Provider-independent search response: the ordered list of results of one gathering call. */
public record SearchResponse(List<SourceRecord> results) {

  public SearchResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static SearchResponse empty() {
    return new SearchResponse(List.of());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }
}
