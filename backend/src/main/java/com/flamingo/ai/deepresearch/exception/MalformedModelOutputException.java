package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a structured (JSON) model call returns output that cannot be used. */
public class MalformedModelOutputException extends RuntimeException {

  private final String agent;

  public MalformedModelOutputException(String agent, String message) {
    super(message);
    this.agent = agent;
  }

  public MalformedModelOutputException(String agent, String message, Throwable cause) {
    super(message, cause);
    this.agent = agent;
  }

  public String getAgent() {
    return agent;
  }

  public String getUserMessage() {
    return "The language model returned an unusable response.";
  }
}
