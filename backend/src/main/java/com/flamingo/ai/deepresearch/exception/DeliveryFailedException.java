package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the finished summary cannot be handed to the mail transport. */
public class DeliveryFailedException extends RuntimeException {

  private final String recipient;

  public DeliveryFailedException(String recipient, String message, Throwable cause) {
    super(message, cause);
    this.recipient = recipient;
  }

  public String getRecipient() {
    return recipient;
  }

  public String getUserMessage() {
    return "The research summary could not be delivered.";
  }
}
