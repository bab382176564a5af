package com.flamingo.ai.deepresearch.domain;

/**
 * Steps of the research state machine. Routing after {@link #REFLECT} is a decision, not a step of
 * its own; see {@code ResearchRouter}.
 */
public enum ResearchStep {
  GENERATE_QUERY,
  WEB_RESEARCH,
  VIDEO_RESEARCH,
  SUMMARIZE,
  REFLECT,
  FINALIZE,
  DELIVER,
  END
}
