package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.domain.RouteDecision;

/**
 * Decision taken after each reflection. The comparison is inclusive and the loop count is
 * incremented after the web step, so a ceiling of {@code n} yields {@code n + 1} web searches.
 */
public final class ResearchRouter {

  private ResearchRouter() {}

  public static RouteDecision route(int loopCount, int maxLoops) {
    return loopCount <= maxLoops ? RouteDecision.CONTINUE : RouteDecision.FINALIZE;
  }
}
