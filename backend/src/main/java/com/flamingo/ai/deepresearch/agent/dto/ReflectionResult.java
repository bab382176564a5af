package com.flamingo.ai.deepresearch.agent.dto;

/** Structured output from ReflectionAgent. Either field may be missing in model output. */
public record ReflectionResult(String knowledgeGap, String followUpQuery) {}
