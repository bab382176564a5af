package com.flamingo.ai.deepresearch.service.query;

import com.flamingo.ai.deepresearch.agent.QueryWriterAgent;
import com.flamingo.ai.deepresearch.agent.dto.GeneratedQuery;
import com.flamingo.ai.deepresearch.exception.MalformedModelOutputException;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link QueryGenerationService} backed by {@link QueryWriterAgent}. No retries. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryGenerationServiceImpl implements QueryGenerationService {

  static final String AGENT = "query-writer";

  private final QueryWriterAgent queryWriterAgent;

  @Override
  @Timed(value = "research.query_generation", description = "Time to generate the initial query")
  public String generateQuery(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Research topic must not be blank");
    }

    GeneratedQuery result;
    try {
      result = queryWriterAgent.writeQuery(topic);
    } catch (RuntimeException e) {
      throw new MalformedModelOutputException(
          AGENT, "Query generation failed for topic '" + topic + "': " + e.getMessage(), e);
    }

    if (result == null || result.query() == null || result.query().isBlank()) {
      throw new MalformedModelOutputException(
          AGENT, "Model response has no 'query' field for topic '" + topic + "'");
    }

    log.debug(
        "Generated query '{}' (aspect={}, rationale={})",
        result.query(),
        result.aspect(),
        result.rationale());
    return result.query().strip();
  }
}
