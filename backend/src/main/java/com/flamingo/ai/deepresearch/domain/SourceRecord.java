package com.flamingo.ai.deepresearch.domain;

/**
 * One search hit normalized from a provider response. {@code url} is the identity used for
 * deduplication within a single gathering call; {@code rawContent} may be null.
 */
public record SourceRecord(String title, String url, String snippet, String rawContent) {}
