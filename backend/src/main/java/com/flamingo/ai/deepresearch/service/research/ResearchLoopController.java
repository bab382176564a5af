package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.GatheredEvidence;
import com.flamingo.ai.deepresearch.domain.ResearchResult;
import com.flamingo.ai.deepresearch.domain.ResearchState;
import com.flamingo.ai.deepresearch.domain.ResearchStep;
import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import com.flamingo.ai.deepresearch.exception.ResearchRunException;
import com.flamingo.ai.deepresearch.service.delivery.DeliveryNotifier;
import com.flamingo.ai.deepresearch.service.query.QueryGenerationService;
import com.flamingo.ai.deepresearch.service.reflection.ReflectionService;
import com.flamingo.ai.deepresearch.service.search.WebResearchService;
import com.flamingo.ai.deepresearch.service.summary.SummarizationService;
import com.flamingo.ai.deepresearch.service.video.VideoResearchService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one research run through the {@link ResearchStep} state machine:
 *
 * <pre>
 * GENERATE_QUERY -> WEB_RESEARCH -> VIDEO_RESEARCH -> SUMMARIZE -> REFLECT
 *     REFLECT -> WEB_RESEARCH   while loopCount &lt;= maxResearchLoops
 *     REFLECT -> FINALIZE -> DELIVER -> END
 * </pre>
 *
 * <p>Steps run strictly one after another on the calling thread. Each run owns its own {@link
 * ResearchState}; the controller itself is stateless and may serve concurrent runs.
 *
 * <p>Failures in query generation, web research, summarization, finalization or delivery abort the
 * run with a {@link ResearchRunException} naming the step. Video research failures are logged and
 * skipped. Steps are never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchLoopController {

  private final QueryGenerationService queryGenerationService;
  private final WebResearchService webResearchService;
  private final VideoResearchService videoResearchService;
  private final SummarizationService summarizationService;
  private final ReflectionService reflectionService;
  private final DeliveryNotifier deliveryNotifier;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the research loop for a topic to completion.
   *
   * @param topic non-blank research topic
   * @return the finalized summary and run statistics
   * @throws ConfigurationException if required settings are missing, before any research starts
   * @throws ResearchRunException if a step fails fatally
   */
  @Timed(value = "research.run", description = "Time to run one complete research loop")
  public ResearchResult run(String topic) {
    String runId = UUID.randomUUID().toString().substring(0, 8);
    ResearchState state = new ResearchState(topic);
    int maxLoops = verifyConfiguration();

    log.info("[{}] Starting research on '{}' (maxResearchLoops={})", runId, topic, maxLoops);

    ResearchStep step = ResearchStep.GENERATE_QUERY;
    while (step != ResearchStep.END) {
      try {
        execute(step, state, runId);
      } catch (RuntimeException e) {
        meterRegistry.counter("research.runs.failed", "step", step.name()).increment();
        log.error("[{}] Research run aborted at {}: {}", runId, step, e.getMessage(), e);
        throw new ResearchRunException(runId, step, e);
      }
      step = next(step, state.getLoopCount(), maxLoops);
    }

    meterRegistry.counter("research.runs.completed").increment();
    log.info(
        "[{}] Research on '{}' finished after {} loops (delivered={})",
        runId,
        topic,
        state.getLoopCount(),
        state.isDelivered());
    return new ResearchResult(
        runId, topic, state.getSummary(), state.getLoopCount(), state.isDelivered());
  }

  /** Transition function. Only the step after {@link ResearchStep#REFLECT} depends on state. */
  static ResearchStep next(ResearchStep current, int loopCount, int maxLoops) {
    return switch (current) {
      case GENERATE_QUERY -> ResearchStep.WEB_RESEARCH;
      case WEB_RESEARCH -> ResearchStep.VIDEO_RESEARCH;
      case VIDEO_RESEARCH -> ResearchStep.SUMMARIZE;
      case SUMMARIZE -> ResearchStep.REFLECT;
      case REFLECT -> ResearchRouter.route(loopCount, maxLoops).nextStep();
      case FINALIZE -> ResearchStep.DELIVER;
      case DELIVER -> ResearchStep.END;
      case END -> throw new IllegalStateException("No transition out of END");
    };
  }

  private void execute(ResearchStep step, ResearchState state, String runId) {
    switch (step) {
      case GENERATE_QUERY -> generateQuery(state, runId);
      case WEB_RESEARCH -> webResearch(state, runId);
      case VIDEO_RESEARCH -> videoResearch(state, runId);
      case SUMMARIZE -> summarize(state);
      case REFLECT -> reflect(state, runId);
      case FINALIZE -> state.finalizeSummary(
          SummaryFinalizer.finalizeSummary(state.getSummary(), state.getCitations()));
      case DELIVER -> deliver(state, runId);
      case END -> throw new IllegalStateException("END is not executable");
    }
  }

  private int verifyConfiguration() {
    int maxLoops = researchConfig.getMaxResearchLoops();
    if (maxLoops < 0) {
      throw new ConfigurationException(
          "research.max-research-loops", "Loop ceiling must be >= 0, was " + maxLoops);
    }
    webResearchService.activeProvider();
    if (deliveryNotifier.isEnabled()) {
      deliveryNotifier.verifyConfiguration();
    }
    return maxLoops;
  }

  private void generateQuery(ResearchState state, String runId) {
    String query = queryGenerationService.generateQuery(state.getTopic());
    state.setCurrentQuery(query);
    log.info("[{}] Initial query: '{}'", runId, query);
  }

  private void webResearch(ResearchState state, String runId) {
    GatheredEvidence evidence =
        webResearchService.gather(state.getCurrentQuery(), state.getLoopCount());
    state.appendWebEvidence(evidence.evidence());
    state.appendCitations(evidence.citations());
    state.incrementLoopCount();
    meterRegistry.counter("research.loops").increment();
    log.info(
        "[{}] Web research #{} gathered {} sources",
        runId,
        state.getLoopCount(),
        evidence.sourceCount());
  }

  private void videoResearch(ResearchState state, String runId) {
    if (!videoResearchService.isEnabled()) {
      log.warn("[{}] No YouTube API key configured, skipping video research", runId);
      meterRegistry.counter("research.video.skipped", "reason", "no_api_key").increment();
      return;
    }
    try {
      GatheredEvidence evidence = videoResearchService.gather(state.getCurrentQuery());
      state.appendVideoEvidence(evidence.evidence());
      state.appendCitations(evidence.citations());
      log.info("[{}] Video research gathered {} videos", runId, evidence.sourceCount());
    } catch (EvidenceSourceUnavailableException e) {
      log.warn("[{}] Video research skipped: {}", runId, e.getMessage());
      meterRegistry.counter("research.video.skipped", "reason", "unavailable").increment();
    }
  }

  private void summarize(ResearchState state) {
    String summary =
        summarizationService.summarize(
            state.getTopic(),
            state.getSummary(),
            state.latestWebEvidence(),
            state.joinedVideoEvidence());
    state.updateSummary(summary);
  }

  private void reflect(ResearchState state, String runId) {
    String query = reflectionService.nextQuery(state.getTopic(), state.getSummary());
    state.setCurrentQuery(query);
    log.info("[{}] Next query: '{}'", runId, query);
  }

  private void deliver(ResearchState state, String runId) {
    if (!deliveryNotifier.isEnabled()) {
      log.info("[{}] Delivery disabled, summary not sent", runId);
      return;
    }
    deliveryNotifier.deliver(state.getTopic(), state.getSummary());
    state.markDelivered();
  }
}
