package com.flamingo.ai.deepresearch.domain;

/** Output of a completed research run. */
public record ResearchResult(
    String runId, String topic, String summary, int loopCount, boolean delivered) {}
