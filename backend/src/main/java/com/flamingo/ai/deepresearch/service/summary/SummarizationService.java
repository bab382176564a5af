package com.flamingo.ai.deepresearch.service.summary;

/** Folds new evidence into the running research summary. */
public interface SummarizationService {

  /**
   * Creates or extends the summary.
   *
   * @param topic research topic
   * @param existingSummary current summary, empty before the first summarization
   * @param latestWebEvidence the most recent web evidence block
   * @param videoEvidence all video evidence gathered so far, newline-joined
   * @return the new summary with reasoning spans removed
   * @throws com.flamingo.ai.deepresearch.exception.LlmServiceException if the model call fails
   */
  String summarize(
      String topic, String existingSummary, String latestWebEvidence, String videoEvidence);
}
