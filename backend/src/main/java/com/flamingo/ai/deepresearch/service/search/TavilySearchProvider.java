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

/** Web search through the Tavily search API. Results map one-to-one onto source records. */
@Component
@Slf4j
public class TavilySearchProvider implements WebSearchProvider {

  private final WebClient webClient;
  private final ResearchConfig.Tavily tavily;
  private final Duration readTimeout;

  public TavilySearchProvider(ResearchConfig researchConfig) {
    this.tavily = researchConfig.getTavily();
    this.readTimeout = Duration.ofSeconds(researchConfig.getHttp().getReadTimeoutSeconds());
    int maxInMemory = researchConfig.getHttp().getMaxInMemorySizeBytes();
    this.webClient =
        WebClient.builder()
            .baseUrl(tavily.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemory))
            .build();
  }

  @Override
  @CircuitBreaker(name = "websearch")
  public SearchResponse search(String query, int researchLoopCount) {
    var request =
        new TavilySearchRequest(query, tavily.getMaxResults(), tavily.isIncludeRawContent());
    JsonNode body;
    try {
      body =
          webClient
              .post()
              .uri("/search")
              .contentType(MediaType.APPLICATION_JSON)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + tavily.getApiKey())
              .bodyValue(request)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(readTimeout)
              .block();
    } catch (RuntimeException e) {
      throw new EvidenceSourceUnavailableException(
          id().value(), "Tavily search failed for query '" + query + "': " + e.getMessage(), e);
    }
    if (body == null) {
      throw new EvidenceSourceUnavailableException(id().value(), "Tavily returned an empty body");
    }
    SearchResponse response = toSearchResponse(body);
    log.debug("Tavily returned {} results for '{}'", response.results().size(), query);
    return response;
  }

  static SearchResponse toSearchResponse(JsonNode body) {
    JsonNode results = body.path("results");
    if (!results.isArray()) {
      throw new EvidenceSourceUnavailableException(
          SearchApi.TAVILY.value(), "Tavily response has no results array");
    }
    List<SourceRecord> records = new ArrayList<>();
    for (JsonNode item : results) {
      records.add(
          new SourceRecord(
              text(item, "title"),
              text(item, "url"),
              text(item, "content"),
              text(item, "raw_content")));
    }
    return new SearchResponse(records);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  @Override
  public SearchApi id() {
    return SearchApi.TAVILY;
  }

  @Override
  public int maxTokensPerSource() {
    return tavily.getMaxTokensPerSource();
  }

  @Override
  public boolean includeRawContent() {
    return tavily.isIncludeRawContent();
  }

  record TavilySearchRequest(String query, int max_results, boolean include_raw_content) {}
}
