package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a free-text model call fails in transport or inference. */
public class LlmServiceException extends RuntimeException {

  private final String agent;

  public LlmServiceException(String agent, String message, Throwable cause) {
    super(message, cause);
    this.agent = agent;
  }

  public String getAgent() {
    return agent;
  }

  public String getUserMessage() {
    return "AI service is temporarily unavailable. Please try again later.";
  }
}
