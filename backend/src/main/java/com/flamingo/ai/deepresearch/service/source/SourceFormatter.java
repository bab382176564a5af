package com.flamingo.ai.deepresearch.service.source;

import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the results of one gathering call into the textual evidence block handed to the summarizer
 * and into the bullet citation list kept for the final report.
 *
 * <p>Deduplication is by URL and only within the sources passed to a single call; the same URL
 * gathered in two iterations produces two evidence blocks and two citation lines.
 */
@Component
@Slf4j
public class SourceFormatter {

  /** Rough characters-per-token ratio used to turn a token budget into a character limit. */
  static final int CHARS_PER_TOKEN = 4;

  static final String TRUNCATION_MARKER = "... [truncated]";

  /** Formats the results of several responses, merged in encounter order. */
  public String deduplicateAndFormat(
      List<SearchResponse> responses, int maxTokensPerSource, boolean includeRawContent) {
    List<SourceRecord> merged =
        responses.stream().flatMap(response -> response.results().stream()).toList();
    return deduplicateAndFormatSources(merged, maxTokensPerSource, includeRawContent);
  }

  /**
   * Removes duplicate URLs (first occurrence wins) and renders each unique source as a block with
   * title, URL, snippet and, when requested, raw content cut to {@code maxTokensPerSource * 4}
   * characters.
   *
   * @return the concatenated, trimmed evidence block
   */
  public String deduplicateAndFormatSources(
      List<SourceRecord> sources, int maxTokensPerSource, boolean includeRawContent) {
    Map<String, SourceRecord> unique = new LinkedHashMap<>();
    for (SourceRecord source : sources) {
      unique.putIfAbsent(source.url(), source);
    }

    int charLimit = maxTokensPerSource * CHARS_PER_TOKEN;
    StringBuilder formatted = new StringBuilder("Sources:\n\n");
    for (SourceRecord source : unique.values()) {
      formatted.append("Source ").append(source.title()).append(":\n===\n");
      formatted.append("URL: ").append(source.url()).append("\n===\n");
      formatted
          .append("Most relevant content from source: ")
          .append(source.snippet() == null ? "" : source.snippet())
          .append("\n===\n");
      if (includeRawContent) {
        formatted
            .append("Full source content limited to ")
            .append(maxTokensPerSource)
            .append(" tokens: ")
            .append(truncate(rawContentOf(source), charLimit))
            .append("\n\n");
      }
    }
    return formatted.toString().strip();
  }

  /** One {@code "* title : url"} line per source, in order, without deduplication. */
  public String formatCitations(List<SourceRecord> sources) {
    return sources.stream()
        .map(source -> "* " + source.title() + " : " + source.url())
        .collect(Collectors.joining("\n"));
  }

  private String rawContentOf(SourceRecord source) {
    if (source.rawContent() == null) {
      log.warn("No raw content found for source {}", source.url());
      return "";
    }
    return source.rawContent();
  }

  static String truncate(String rawContent, int charLimit) {
    if (rawContent.length() <= charLimit) {
      return rawContent;
    }
    return rawContent.substring(0, charLimit) + TRUNCATION_MARKER;
  }
}
