package com.flamingo.ai.deepresearch.agent.dto;

/**
 * Structured output from QueryWriterAgent. LangChain4j deserializes the model's JSON response into
 * this record; {@code query} is the only required field.
 */
public record GeneratedQuery(String query, String aspect, String rationale) {}
