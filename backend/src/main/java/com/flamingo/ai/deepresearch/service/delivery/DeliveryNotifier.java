package com.flamingo.ai.deepresearch.service.delivery;

/** Hands a finished research summary to an external transport. */
public interface DeliveryNotifier {

  /** Whether delivery is switched on. When off, the delivery step does nothing. */
  boolean isEnabled();

  /**
   * Checks that everything needed for delivery is configured, so a run can be rejected before any
   * research work starts.
   *
   * @throws com.flamingo.ai.deepresearch.exception.ConfigurationException if something is missing
   */
  void verifyConfiguration();

  /**
   * Sends the summary. Not retried.
   *
   * @throws com.flamingo.ai.deepresearch.exception.DeliveryFailedException if the transport fails
   */
  void deliver(String topic, String summary);
}
