package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.GatheredEvidence;
import com.flamingo.ai.deepresearch.domain.SearchResponse;
import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import com.flamingo.ai.deepresearch.service.source.SourceFormatter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.annotation.Timed;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Web half of the evidence gatherer. Delegates to exactly one configured {@link WebSearchProvider}
 * per call and formats the response into an evidence block and citation list.
 */
@Service
@Slf4j
public class WebResearchService {

  private final Map<SearchApi, WebSearchProvider> providers = new EnumMap<>(SearchApi.class);
  private final SourceFormatter sourceFormatter;
  private final ResearchConfig researchConfig;

  public WebResearchService(
      List<WebSearchProvider> providers,
      SourceFormatter sourceFormatter,
      ResearchConfig researchConfig) {
    providers.forEach(provider -> this.providers.put(provider.id(), provider));
    this.sourceFormatter = sourceFormatter;
    this.researchConfig = researchConfig;
  }

  /**
   * Resolves the configured provider.
   *
   * @throws ConfigurationException if the configured name is unknown or has no implementation
   */
  public WebSearchProvider activeProvider() {
    SearchApi api = SearchApi.fromValue(researchConfig.getSearchProvider());
    WebSearchProvider provider = providers.get(api);
    if (provider == null) {
      throw new ConfigurationException(
          "research.search-provider", "No implementation registered for search API: " + api);
    }
    return provider;
  }

  /**
   * Runs one web search and formats the results.
   *
   * @throws EvidenceSourceUnavailableException when the provider fails or its circuit is open
   */
  @Timed(value = "research.web_search", description = "Time to run one web search")
  public GatheredEvidence gather(String query, int researchLoopCount) {
    WebSearchProvider provider = activeProvider();
    log.info("Web search #{} via {}: '{}'", researchLoopCount + 1, provider.id().value(), query);

    SearchResponse response;
    try {
      response = provider.search(query, researchLoopCount);
    } catch (CallNotPermittedException e) {
      throw new EvidenceSourceUnavailableException(
          provider.id().value(), "Web search circuit breaker is open", e);
    }
    String evidence =
        sourceFormatter.deduplicateAndFormat(
            List.of(response), provider.maxTokensPerSource(), provider.includeRawContent());
    String citations = sourceFormatter.formatCitations(response.results());
    return new GatheredEvidence(evidence, citations, response.results().size());
  }
}
