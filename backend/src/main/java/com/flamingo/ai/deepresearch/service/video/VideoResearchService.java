package com.flamingo.ai.deepresearch.service.video;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.GatheredEvidence;
import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import com.flamingo.ai.deepresearch.exception.TranscriptTimeoutException;
import com.flamingo.ai.deepresearch.service.source.SourceFormatter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Video half of the evidence gatherer: searches YouTube and attaches each hit's transcript. A
 * transcript that times out or cannot be fetched is replaced by a sentinel text; the record is
 * kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoResearchService {

  static final String TRANSCRIPT_TIMED_OUT = "Transcript retrieval timed out.";
  static final String TRANSCRIPT_UNAVAILABLE = "Transcript not available.";
  static final int SNIPPET_LENGTH = 200;

  private final YouTubeSearchClient youTubeSearchClient;
  private final TranscriptService transcriptService;
  private final SourceFormatter sourceFormatter;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  /** Whether an API key is configured. Without one, video research is skipped, not attempted. */
  public boolean isEnabled() {
    return researchConfig.getYoutube().isEnabled();
  }

  /**
   * Searches videos for the query and formats them with their transcripts.
   *
   * @throws com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException when the
   *     search itself fails
   */
  @Timed(value = "research.video_search", description = "Time to search videos and transcripts")
  public GatheredEvidence gather(String query) {
    ResearchConfig.Youtube youtube = researchConfig.getYoutube();
    SearchResponse response = search(query, youtube.getMaxResults());
    String evidence =
        sourceFormatter.deduplicateAndFormat(
            List.of(response), youtube.getMaxTokensPerSource(), true);
    String citations = sourceFormatter.formatCitations(response.results());
    return new GatheredEvidence(evidence, citations, response.results().size());
  }

  SearchResponse search(String query, int maxResults) {
    List<YouTubeSearchClient.VideoHit> hits;
    try {
      hits = youTubeSearchClient.searchVideos(query, maxResults);
    } catch (CallNotPermittedException e) {
      throw new EvidenceSourceUnavailableException(
          YouTubeSearchClient.SOURCE, "YouTube circuit breaker is open", e);
    }
    log.info("YouTube search '{}' returned {} videos", query, hits.size());

    List<SourceRecord> records = new ArrayList<>();
    for (YouTubeSearchClient.VideoHit hit : hits.subList(0, Math.min(hits.size(), maxResults))) {
      String transcript = transcriptFor(hit.videoId());
      records.add(new SourceRecord(hit.title(), hit.url(), snippetOf(transcript), transcript));
    }
    return new SearchResponse(records);
  }

  private String transcriptFor(String videoId) {
    try {
      return transcriptService.fetch(videoId);
    } catch (TranscriptTimeoutException e) {
      log.warn("{}", e.getMessage());
      meterRegistry.counter("research.transcript.timeouts").increment();
      return TRANSCRIPT_TIMED_OUT;
    } catch (RuntimeException e) {
      log.warn("Transcript fetch failed for video {}: {}", videoId, e.getMessage());
      meterRegistry.counter("research.transcript.failures").increment();
      return TRANSCRIPT_UNAVAILABLE;
    }
  }

  static String snippetOf(String transcript) {
    return transcript.length() > SNIPPET_LENGTH
        ? transcript.substring(0, SNIPPET_LENGTH) + "..."
        : transcript;
  }
}
