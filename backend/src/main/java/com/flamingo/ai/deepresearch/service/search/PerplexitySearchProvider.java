package com.flamingo.ai.deepresearch.service.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Web search through Perplexity chat completions. Perplexity answers with one text plus a list of
 * citation URLs; the text is attached to the first citation and the remaining citations become
 * reference-only records.
 */
@Component
@Slf4j
public class PerplexitySearchProvider implements WebSearchProvider {

  static final String SYSTEM_PROMPT =
      "Search the web and provide factual information with sources.";
  static final String DEFAULT_CITATION = "https://perplexity.ai";
  static final String SEE_ABOVE = "See above for full content";

  private final WebClient webClient;
  private final ResearchConfig.Perplexity perplexity;
  private final Duration readTimeout;

  public PerplexitySearchProvider(ResearchConfig researchConfig) {
    this.perplexity = researchConfig.getPerplexity();
    this.readTimeout = Duration.ofSeconds(researchConfig.getHttp().getReadTimeoutSeconds());
    int maxInMemory = researchConfig.getHttp().getMaxInMemorySizeBytes();
    this.webClient =
        WebClient.builder()
            .baseUrl(perplexity.getBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemory))
            .build();
  }

  @Override
  @CircuitBreaker(name = "websearch")
  public SearchResponse search(String query, int researchLoopCount) {
    var request =
        new ChatCompletionRequest(
            perplexity.getModel(),
            List.of(new Message("system", SYSTEM_PROMPT), new Message("user", query)));
    JsonNode body;
    try {
      body =
          webClient
              .post()
              .uri("/chat/completions")
              .contentType(MediaType.APPLICATION_JSON)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + perplexity.getApiKey())
              .bodyValue(request)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(readTimeout)
              .block();
    } catch (RuntimeException e) {
      throw new EvidenceSourceUnavailableException(
          id().value(), "Perplexity search failed for query '" + query + "': " + e.getMessage(), e);
    }
    if (body == null) {
      throw new EvidenceSourceUnavailableException(
          id().value(), "Perplexity returned an empty body");
    }
    SearchResponse response = toSearchResponse(body, researchLoopCount);
    log.debug("Perplexity returned {} citations for '{}'", response.results().size(), query);
    return response;
  }

  static SearchResponse toSearchResponse(JsonNode body, int researchLoopCount) {
    JsonNode content = body.path("choices").path(0).path("message").path("content");
    if (content.isMissingNode() || content.isNull()) {
      throw new EvidenceSourceUnavailableException(
          SearchApi.PERPLEXITY.value(), "Perplexity response has no message content");
    }
    String answer = content.asText();

    List<String> citations = new ArrayList<>();
    JsonNode citationNodes = body.path("citations");
    if (citationNodes.isArray()) {
      citationNodes.forEach(node -> citations.add(node.asText()));
    }
    if (citations.isEmpty()) {
      citations.add(DEFAULT_CITATION);
    }

    int searchNumber = researchLoopCount + 1;
    List<SourceRecord> records = new ArrayList<>();
    records.add(new SourceRecord(title(searchNumber, 1), citations.get(0), answer, answer));
    for (int i = 1; i < citations.size(); i++) {
      records.add(new SourceRecord(title(searchNumber, i + 1), citations.get(i), SEE_ABOVE, null));
    }
    return new SearchResponse(records);
  }

  private static String title(int searchNumber, int sourceNumber) {
    return "Perplexity Search " + searchNumber + ", Source " + sourceNumber;
  }

  @Override
  public SearchApi id() {
    return SearchApi.PERPLEXITY;
  }

  @Override
  public int maxTokensPerSource() {
    return perplexity.getMaxTokensPerSource();
  }

  @Override
  public boolean includeRawContent() {
    return false;
  }

  record ChatCompletionRequest(String model, List<Message> messages) {}

  record Message(String role, String content) {}
}
