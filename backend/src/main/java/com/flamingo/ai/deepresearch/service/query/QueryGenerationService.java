package com.flamingo.ai.deepresearch.service.query;

/** Produces the first web search query of a research run. */
public interface QueryGenerationService {

  /**
   * Generates a search query for the topic.
   *
   * @param topic non-blank research topic
   * @return a non-blank query
   * @throws com.flamingo.ai.deepresearch.exception.MalformedModelOutputException if the model
   *     output cannot be parsed or has no query
   */
  String generateQuery(String topic);
}
