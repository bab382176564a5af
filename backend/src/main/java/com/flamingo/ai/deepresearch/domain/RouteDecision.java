package com.flamingo.ai.deepresearch.domain;

/** Outcome of the routing decision taken after reflection. */
public enum RouteDecision {
  CONTINUE(ResearchStep.WEB_RESEARCH),
  FINALIZE(ResearchStep.FINALIZE);

  private final ResearchStep nextStep;

  RouteDecision(ResearchStep nextStep) {
    this.nextStep = nextStep;
  }

  public ResearchStep nextStep() {
    return nextStep;
  }
}
