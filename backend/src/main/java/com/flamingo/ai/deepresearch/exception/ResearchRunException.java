package com.flamingo.ai.deepresearch.exception;

import com.flamingo.ai.deepresearch.domain.ResearchStep;

/**
 * Exception thrown when a research run aborts. Carries the step that failed so callers can report
 * where the run stopped; the original failure is kept as the cause.
 */
public class ResearchRunException extends RuntimeException {

  private final String runId;
  private final ResearchStep step;

  public ResearchRunException(String runId, ResearchStep step, Throwable cause) {
    super(
        String.format(
            "Research run %s failed at step %s: %s", runId, step, cause.getMessage()),
        cause);
    this.runId = runId;
    this.step = step;
  }

  public String getRunId() {
    return runId;
  }

  public ResearchStep getStep() {
    return step;
  }
}
