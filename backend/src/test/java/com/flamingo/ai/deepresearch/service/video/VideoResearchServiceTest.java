package com.flamingo.ai.deepresearch.service.video;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.GatheredEvidence;
import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.domain.SourceRecord;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import com.flamingo.ai.deepresearch.exception.TranscriptTimeoutException;
import com.flamingo.ai.deepresearch.exception.TranscriptUnavailableException;
import com.flamingo.ai.deepresearch.service.source.SourceFormatter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VideoResearchServiceTest {

  @Mock private YouTubeSearchClient youTubeSearchClient;

  @Mock private TranscriptService transcriptService;

  private ResearchConfig researchConfig;
  private MeterRegistry meterRegistry;
  private VideoResearchService service;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new VideoResearchService(
            youTubeSearchClient,
            transcriptService,
            new SourceFormatter(),
            researchConfig,
            meterRegistry);
  }

  @Test
  void shouldKeepVideos_withSentinels_whenTranscriptsFail() {
    // Given
    when(youTubeSearchClient.searchVideos("quantum dots", 3))
        .thenReturn(
            List.of(
                new YouTubeSearchClient.VideoHit("ok", "Works"),
                new YouTubeSearchClient.VideoHit("slow", "Hangs"),
                new YouTubeSearchClient.VideoHit("broken", "Fails")));
    when(transcriptService.fetch("ok")).thenReturn("short transcript");
    when(transcriptService.fetch("slow"))
        .thenThrow(new TranscriptTimeoutException("slow", Duration.ofSeconds(10)));
    when(transcriptService.fetch("broken"))
        .thenThrow(
            new TranscriptUnavailableException(
                "broken", new IOException("disabled")));

    // When
    SearchResponse response = service.search("quantum dots", 3);

    // Then
    assertThat(response.results())
        .containsExactly(
            new SourceRecord(
                "Works",
                "https://www.youtube.com/watch?v=ok",
                "short transcript",
                "short transcript"),
            new SourceRecord(
                "Hangs",
                "https://www.youtube.com/watch?v=slow",
                VideoResearchService.TRANSCRIPT_TIMED_OUT,
                VideoResearchService.TRANSCRIPT_TIMED_OUT),
            new SourceRecord(
                "Fails",
                "https://www.youtube.com/watch?v=broken",
                VideoResearchService.TRANSCRIPT_UNAVAILABLE,
                VideoResearchService.TRANSCRIPT_UNAVAILABLE));
    assertThat(meterRegistry.counter("research.transcript.timeouts").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("research.transcript.failures").count()).isEqualTo(1.0);
  }

  @Test
  void shouldFormatEvidenceAndCitations() {
    when(youTubeSearchClient.searchVideos("q", 3))
        .thenReturn(List.of(new YouTubeSearchClient.VideoHit("v1", "Lecture")));
    when(transcriptService.fetch("v1")).thenReturn("t".repeat(300));

    GatheredEvidence evidence = service.gather("q");

    assertThat(evidence.sourceCount()).isEqualTo(1);
    assertThat(evidence.citations()).isEqualTo("* Lecture : https://www.youtube.com/watch?v=v1");
    assertThat(evidence.evidence())
        .contains("Most relevant content from source: " + "t".repeat(200) + "...")
        .contains("Full source content limited to 500 tokens: " + "t".repeat(300));
  }

  @Test
  void shouldPropagateSearchFailure() {
    when(youTubeSearchClient.searchVideos("q", 3))
        .thenThrow(new EvidenceSourceUnavailableException("youtube", "quota exceeded"));

    assertThatThrownBy(() -> service.gather("q"))
        .isInstanceOf(EvidenceSourceUnavailableException.class);
  }

  @Test
  void shouldBeDisabled_withoutApiKey() {
    assertThat(service.isEnabled()).isFalse();

    researchConfig.getYoutube().setApiKey("key");

    assertThat(service.isEnabled()).isTrue();
  }

  @Test
  void shouldCutSnippetAt200Characters() {
    assertThat(VideoResearchService.snippetOf("a".repeat(200))).isEqualTo("a".repeat(200));
    assertThat(VideoResearchService.snippetOf("a".repeat(201))).isEqualTo("a".repeat(200) + "...");
  }
}
