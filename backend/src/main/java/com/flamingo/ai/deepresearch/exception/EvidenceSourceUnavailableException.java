package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a search provider cannot be reached or answers with an error. */
public class EvidenceSourceUnavailableException extends RuntimeException {

  private final String source;

  public EvidenceSourceUnavailableException(String source, String message) {
    super(message);
    this.source = source;
  }

  public EvidenceSourceUnavailableException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return "Search provider '" + source + "' is temporarily unavailable.";
  }
}
