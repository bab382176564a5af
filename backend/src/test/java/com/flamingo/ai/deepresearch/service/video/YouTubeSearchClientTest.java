package com.flamingo.ai.deepresearch.service.video;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class YouTubeSearchClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void shouldMapItemsToVideoHits_cappedAtMaxResults() throws Exception {
    JsonNode body =
        objectMapper.readTree(
            """
            {"items": [
              {"id": {"kind": "youtube#video", "videoId": "v1"}, "snippet": {"title": "One"}},
              {"id": {"kind": "youtube#channel", "channelId": "c1"}, "snippet": {"title": "Chan"}},
              {"id": {"videoId": "v2"}, "snippet": {"title": "Two"}},
              {"id": {"videoId": "v3"}, "snippet": {"title": "Three"}}
            ]}
            """);

    List<YouTubeSearchClient.VideoHit> hits = YouTubeSearchClient.toVideoHits(body, 2);

    assertThat(hits)
        .containsExactly(
            new YouTubeSearchClient.VideoHit("v1", "One"),
            new YouTubeSearchClient.VideoHit("v2", "Two"));
    assertThat(hits.get(0).url()).isEqualTo("https://www.youtube.com/watch?v=v1");
  }

  @Test
  void shouldReturnEmpty_whenNoItems() throws Exception {
    assertThat(YouTubeSearchClient.toVideoHits(objectMapper.readTree("{}"), 3)).isEmpty();
  }
}
