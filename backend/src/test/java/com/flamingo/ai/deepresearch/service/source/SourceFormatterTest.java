package com.flamingo.ai.deepresearch.service.source;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SourceFormatter Tests")
class SourceFormatterTest {

  private final SourceFormatter formatter = new SourceFormatter();

  @Nested
  @DisplayName("deduplicateAndFormatSources")
  class DeduplicateAndFormat {

    @Test
    @DisplayName("should keep first occurrence of a duplicated URL")
    void shouldKeepFirstOccurrence() {
      List<SourceRecord> sources =
          List.of(
              new SourceRecord("A1", "a", "first a", null),
              new SourceRecord("B", "b", "only b", null),
              new SourceRecord("A2", "a", "second a", null));

      String block = formatter.deduplicateAndFormatSources(sources, 100, false);

      assertThat(block)
          .contains("Source A1:")
          .contains("Source B:")
          .doesNotContain("A2")
          .doesNotContain("second a");
    }

    @Test
    @DisplayName("should render title, url and snippet in block layout")
    void shouldRenderBlockLayout() {
      String block =
          formatter.deduplicateAndFormatSources(
              List.of(new SourceRecord("Title", "https://x.org", "snippet text", "raw")),
              10,
              false);

      assertThat(block)
          .isEqualTo(
              "Sources:\n\n"
                  + "Source Title:\n===\n"
                  + "URL: https://x.org\n===\n"
                  + "Most relevant content from source: snippet text\n===");
    }

    @Test
    @DisplayName("should truncate raw content to four characters per token and mark the cut")
    void shouldTruncateRawContent() {
      String raw = "x".repeat(60) + "y".repeat(40);

      String block =
          formatter.deduplicateAndFormatSources(
              List.of(new SourceRecord("T", "u", "s", raw)), 10, true);

      String expected =
          "Full source content limited to 10 tokens: "
              + "x".repeat(40)
              + SourceFormatter.TRUNCATION_MARKER;
      assertThat(block).endsWith(expected);
      assertThat(block).doesNotContain("y");
    }

    @Test
    @DisplayName("should leave raw content within budget untouched")
    void shouldNotTruncateShortRawContent() {
      String block =
          formatter.deduplicateAndFormatSources(
              List.of(new SourceRecord("T", "u", "s", "short raw")), 10, true);

      assertThat(block).endsWith("tokens: short raw").doesNotContain("[truncated]");
    }

    @Test
    @DisplayName("should substitute empty string for missing raw content")
    void shouldHandleMissingRawContent() {
      String block =
          formatter.deduplicateAndFormatSources(
              List.of(new SourceRecord("T", "u", "s", null)), 10, true);

      assertThat(block).endsWith("Full source content limited to 10 tokens:");
    }

    @Test
    @DisplayName("should render a missing snippet as empty text")
    void shouldHandleMissingSnippet() {
      String block =
          formatter.deduplicateAndFormatSources(
              List.of(new SourceRecord("T", "u", null, null)), 10, false);

      assertThat(block)
          .endsWith("Most relevant content from source: \n===")
          .doesNotContain("null");
    }

    @Test
    @DisplayName("should merge several responses in encounter order before deduplicating")
    void shouldMergeResponses() {
      SearchResponse first =
          new SearchResponse(List.of(new SourceRecord("One", "u1", "s", null)));
      SearchResponse second =
          new SearchResponse(
              List.of(
                  new SourceRecord("Dup", "u1", "s", null),
                  new SourceRecord("Two", "u2", "s", null)));

      String block = formatter.deduplicateAndFormat(List.of(first, second), 10, false);

      assertThat(block.indexOf("Source One:")).isLessThan(block.indexOf("Source Two:"));
      assertThat(block).doesNotContain("Dup");
    }

    @Test
    @DisplayName("should produce only the header for no sources")
    void shouldHandleEmptySources() {
      assertThat(formatter.deduplicateAndFormatSources(List.of(), 10, true)).isEqualTo("Sources:");
    }
  }

  @Nested
  @DisplayName("formatCitations")
  class FormatCitations {

    @Test
    @DisplayName("should emit one bullet per source without deduplication")
    void shouldNotDeduplicate() {
      List<SourceRecord> sources =
          List.of(
              new SourceRecord("A1", "a", "s", null),
              new SourceRecord("A2", "a", "s", null));

      assertThat(formatter.formatCitations(sources)).isEqualTo("* A1 : a\n* A2 : a");
    }

    @Test
    @DisplayName("should return empty string for no sources")
    void shouldReturnEmptyForNoSources() {
      assertThat(formatter.formatCitations(List.of())).isEmpty();
    }
  }
}
