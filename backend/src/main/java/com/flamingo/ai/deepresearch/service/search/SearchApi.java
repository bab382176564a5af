package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;

/** Supported web search providers, selected by {@code research.search-provider}. */
public enum SearchApi {
  TAVILY("tavily"),
  PERPLEXITY("perplexity");

  private final String value;

  SearchApi(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolves a configured provider name (case-insensitive).
   *
   * @throws ConfigurationException if the name is blank or unknown
   */
  public static SearchApi fromValue(String name) {
    if (name == null || name.isBlank()) {
      throw new ConfigurationException(
          "research.search-provider", "No search provider configured");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(api -> api.value.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "research.search-provider", "Unsupported search API: " + name));
  }
}
