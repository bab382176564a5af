package com.flamingo.ai.deepresearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import org.junit.jupiter.api.Test;

class PerplexitySearchProviderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void shouldAttachAnswerToFirstCitation_andReferenceTheRest() throws Exception {
    // Given
    JsonNode body =
        objectMapper.readTree(
            """
            {"choices": [{"message": {"role": "assistant", "content": "Quantum dots are..."}}],
             "citations": ["https://a.org", "https://b.org", "https://c.org"]}
            """);

    // When
    SearchResponse response = PerplexitySearchProvider.toSearchResponse(body, 1);

    // Then
    assertThat(response.results())
        .containsExactly(
            new SourceRecord(
                "Perplexity Search 2, Source 1",
                "https://a.org",
                "Quantum dots are...",
                "Quantum dots are..."),
            new SourceRecord(
                "Perplexity Search 2, Source 2",
                "https://b.org",
                PerplexitySearchProvider.SEE_ABOVE,
                null),
            new SourceRecord(
                "Perplexity Search 2, Source 3",
                "https://c.org",
                PerplexitySearchProvider.SEE_ABOVE,
                null));
  }

  @Test
  void shouldUseDefaultCitation_whenNoneReturned() throws Exception {
    JsonNode body =
        objectMapper.readTree(
            """
            {"choices": [{"message": {"content": "answer"}}]}
            """);

    SearchResponse response = PerplexitySearchProvider.toSearchResponse(body, 0);

    assertThat(response.results()).hasSize(1);
    assertThat(response.results().get(0).url())
        .isEqualTo(PerplexitySearchProvider.DEFAULT_CITATION);
    assertThat(response.results().get(0).title()).isEqualTo("Perplexity Search 1, Source 1");
  }

  @Test
  void shouldFail_whenContentMissing() throws Exception {
    JsonNode body = objectMapper.readTree("{\"choices\": []}");

    assertThatThrownBy(() -> PerplexitySearchProvider.toSearchResponse(body, 0))
        .isInstanceOf(EvidenceSourceUnavailableException.class);
  }
}
