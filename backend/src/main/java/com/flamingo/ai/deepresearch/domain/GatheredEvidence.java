package com.flamingo.ai.deepresearch.domain;

/** Formatted result of one gathering call: the evidence block and its citation list. */
public record GatheredEvidence(String evidence, String citations, int sourceCount) {}
