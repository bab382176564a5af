package com.flamingo.ai.deepresearch.service.research;

import java.util.List;

/** Builds the presentation form of a finished summary: header, body and every citation list. */
public final class SummaryFinalizer {

  static final String HEADER = "## Summary";
  static final String SOURCES_HEADER = "### Sources:";

  private SummaryFinalizer() {}

  public static String finalizeSummary(String summary, List<String> citations) {
    String allSources = String.join("\n", citations);
    return HEADER + "\n\n" + summary + "\n\n" + SOURCES_HEADER + "\n" + allSources;
  }
}
