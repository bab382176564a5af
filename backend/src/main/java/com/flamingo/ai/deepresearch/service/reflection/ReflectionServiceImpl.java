package com.flamingo.ai.deepresearch.service.reflection;

import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.agent.dto.ReflectionResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link ReflectionService} backed by {@link ReflectionAgent}. Never fails. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectionServiceImpl implements ReflectionService {

  private final ReflectionAgent reflectionAgent;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "research.reflect", description = "Time to reflect on the summary")
  public String nextQuery(String topic, String summary) {
    ReflectionResult result;
    try {
      result = reflectionAgent.reflect(topic, summary == null ? "" : summary);
    } catch (Exception e) {
      log.warn("Reflection failed for topic '{}', using fallback query: {}", topic, e.getMessage());
      return fallback(topic);
    }

    if (result == null || result.followUpQuery() == null || result.followUpQuery().isBlank()) {
      log.warn("Reflection returned no follow-up query for topic '{}'", topic);
      return fallback(topic);
    }

    log.debug("Knowledge gap for '{}': {}", topic, result.knowledgeGap());
    return result.followUpQuery().strip();
  }

  private String fallback(String topic) {
    meterRegistry.counter("research.reflection.fallback").increment();
    return fallbackQuery(topic);
  }

  static String fallbackQuery(String topic) {
    return "Tell me more about " + topic;
  }
}
