package com.flamingo.ai.deepresearch.service.reflection;

/** Finds a knowledge gap in the running summary and turns it into the next search query. */
public interface ReflectionService {

  /**
   * Always returns a usable query; falls back to {@code "Tell me more about {topic}"} when the
   * model gives no follow-up.
   */
  String nextQuery(String topic, String summary);
}
