package com.flamingo.ai.deepresearch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Error body returned by the REST layer. A failed research run also reports its id and step. */
@Getter
@Builder
public class ApiError {

  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String MALFORMED_MODEL_OUTPUT = "LLM_001";
  public static final String LLM_UNAVAILABLE = "LLM_002";
  public static final String SEARCH_UNAVAILABLE = "SEARCH_001";
  public static final String DELIVERY_FAILED = "DELIVERY_001";
  public static final String RESEARCH_FAILED = "RESEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Correlates the response with the server log line. */
  private final String errorId;

  private final String code;

  /** Safe to show to the caller; never contains provider responses or credentials. */
  private final String message;

  /** Id of the aborted research run, if any. */
  private final String runId;

  /** Name of the step the run stopped at, if any. */
  private final String stage;

  private final Instant timestamp;

  private final String path;
}
