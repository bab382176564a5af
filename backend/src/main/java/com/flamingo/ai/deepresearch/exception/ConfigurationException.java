package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a required setting is missing or invalid. */
public class ConfigurationException extends RuntimeException {

  private final String property;

  public ConfigurationException(String property, String message) {
    super(message);
    this.property = property;
  }

  public String getProperty() {
    return property;
  }

  public String getUserMessage() {
    return "Research service is misconfigured: " + property;
  }
}
