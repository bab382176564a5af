package com.flamingo.ai.deepresearch.service.video;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import io.github.thoroldvix.api.TranscriptApiFactory;
import io.github.thoroldvix.api.TranscriptContent;
import io.github.thoroldvix.api.TranscriptRetrievalException;
import io.github.thoroldvix.api.YoutubeTranscriptApi;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** {@link TranscriptFetcher} backed by the youtube-transcript-api library. */
@Component
public class YoutubeTranscriptApiFetcher implements TranscriptFetcher {

  private final YoutubeTranscriptApi transcriptApi;
  private final String[] languages;

  public YoutubeTranscriptApiFetcher(ResearchConfig researchConfig) {
    this.transcriptApi = TranscriptApiFactory.createDefault();
    this.languages = researchConfig.getYoutube().getTranscriptLanguages().toArray(new String[0]);
  }

  @Override
  public String fetchTranscript(String videoId) throws TranscriptRetrievalException {
    TranscriptContent content = transcriptApi.getTranscript(videoId, languages);
    return content.getContent().stream()
        .map(TranscriptContent.Fragment::getText)
        .collect(Collectors.joining(" "));
  }
}
