package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.domain.ResearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed research run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchResponse {

  private String runId;
  private String topic;
  private String summary;
  private int loopCount;
  private boolean delivered;

  public static ResearchResponse fromResult(ResearchResult result) {
    return ResearchResponse.builder()
        .runId(result.runId())
        .topic(result.topic())
        .summary(result.summary())
        .loopCount(result.loopCount())
        .delivered(result.delivered())
        .build();
  }
}
