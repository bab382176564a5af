package com.flamingo.ai.deepresearch.service.summary;

import com.flamingo.ai.deepresearch.agent.SummarizerAgent;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link SummarizationService} backed by {@link SummarizerAgent} in free-text mode. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummarizationServiceImpl implements SummarizationService {

  static final String AGENT = "summarizer";

  private final SummarizerAgent summarizerAgent;

  @Override
  @Timed(value = "research.summarize", description = "Time to fold evidence into the summary")
  public String summarize(
      String topic, String existingSummary, String latestWebEvidence, String videoEvidence) {
    String web = latestWebEvidence == null ? "" : latestWebEvidence;
    String video = videoEvidence == null ? "" : videoEvidence;
    boolean extending = existingSummary != null && !existingSummary.isEmpty();

    log.debug(
        "Summarizing topic '{}' ({}): web={} chars, video={} chars",
        topic,
        extending ? "extend" : "new",
        web.length(),
        video.length());

    String response;
    try {
      response =
          extending
              ? summarizerAgent.extendSummary(topic, existingSummary, web, video)
              : summarizerAgent.summarize(topic, web, video);
    } catch (RuntimeException e) {
      throw new LlmServiceException(
          AGENT, "Summarization failed for topic '" + topic + "': " + e.getMessage(), e);
    }

    String summary = ThinkTagStripper.strip(response);
    log.debug("Summary now {} chars", summary.length());
    return summary;
  }
}
