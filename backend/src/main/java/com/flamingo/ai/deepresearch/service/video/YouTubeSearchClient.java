package com.flamingo.ai.deepresearch.service.video;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the YouTube Data API v3 search endpoint. */
@Component
@Slf4j
public class YouTubeSearchClient {

  static final String SOURCE = "youtube";

  private final WebClient webClient;
  private final ResearchConfig.Youtube youtube;
  private final Duration readTimeout;

  public YouTubeSearchClient(ResearchConfig researchConfig) {
    this.youtube = researchConfig.getYoutube();
    this.readTimeout = Duration.ofSeconds(researchConfig.getHttp().getReadTimeoutSeconds());
    this.webClient = WebClient.builder().baseUrl(youtube.getBaseUrl()).build();
    log.info("YouTube search client initialized: baseUrl={}", youtube.getBaseUrl());
  }

  /**
   * Searches videos matching the query.
   *
   * @return hits in API order, at most {@code maxResults}
   * @throws EvidenceSourceUnavailableException on network errors or error statuses
   */
  @CircuitBreaker(name = "youtube")
  public List<VideoHit> searchVideos(String query, int maxResults) {
    JsonNode body;
    try {
      body =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/search")
                          .queryParam("part", "snippet")
                          .queryParam("q", "{q}")
                          .queryParam("type", "video")
                          .queryParam("maxResults", maxResults)
                          .queryParam("key", "{key}")
                          .build(query, youtube.getApiKey()))
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(readTimeout)
              .block();
    } catch (RuntimeException e) {
      throw new EvidenceSourceUnavailableException(
          SOURCE, "YouTube search failed for query '" + query + "': " + e.getMessage(), e);
    }
    return body == null ? List.of() : toVideoHits(body, maxResults);
  }

  static List<VideoHit> toVideoHits(JsonNode body, int maxResults) {
    List<VideoHit> hits = new ArrayList<>();
    for (JsonNode item : body.path("items")) {
      if (hits.size() >= maxResults) {
        break;
      }
      String videoId = item.path("id").path("videoId").asText("");
      if (videoId.isEmpty()) {
        continue;
      }
      hits.add(new VideoHit(videoId, item.path("snippet").path("title").asText(videoId)));
    }
    return hits;
  }

  /** A video found by search. */
  public record VideoHit(String videoId, String title) {

    public String url() {
      return "https://www.youtube.com/watch?v=" + videoId;
    }
  }
}
