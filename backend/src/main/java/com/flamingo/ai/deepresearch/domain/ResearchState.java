package com.flamingo.ai.deepresearch.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable record threaded through one research run. Evidence and citation sequences are
 * append-only; the summary is replaced on each summarization until it is finalized, after which it
 * never changes.
 *
 * <p>Instances are confined to the run that created them and are not thread-safe.
 */
public class ResearchState {

  private final String topic;
  private final List<String> webEvidence = new ArrayList<>();
  private final List<String> videoEvidence = new ArrayList<>();
  private final List<String> citations = new ArrayList<>();

  private String currentQuery;
  private int loopCount;
  private String summary;
  private boolean finalized;
  private boolean delivered;

  public ResearchState(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Research topic must not be blank");
    }
    this.topic = topic;
  }

  public String getTopic() {
    return topic;
  }

  public String getCurrentQuery() {
    return currentQuery;
  }

  public void setCurrentQuery(String currentQuery) {
    this.currentQuery = currentQuery;
  }

  public int getLoopCount() {
    return loopCount;
  }

  /** Records one completed web-research step. */
  public void incrementLoopCount() {
    loopCount++;
  }

  public List<String> getWebEvidence() {
    return Collections.unmodifiableList(webEvidence);
  }

  public List<String> getVideoEvidence() {
    return Collections.unmodifiableList(videoEvidence);
  }

  public List<String> getCitations() {
    return Collections.unmodifiableList(citations);
  }

  public void appendWebEvidence(String block) {
    webEvidence.add(Objects.requireNonNull(block, "block"));
  }

  public void appendVideoEvidence(String block) {
    videoEvidence.add(Objects.requireNonNull(block, "block"));
  }

  public void appendCitations(String citationList) {
    citations.add(Objects.requireNonNull(citationList, "citationList"));
  }

  /** Most recent web evidence block, or empty string before the first web step. */
  public String latestWebEvidence() {
    return webEvidence.isEmpty() ? "" : webEvidence.get(webEvidence.size() - 1);
  }

  /** All video evidence gathered so far, newline-joined. */
  public String joinedVideoEvidence() {
    return String.join("\n", videoEvidence);
  }

  /** Current summary; empty until the first summarization completes. */
  public String getSummary() {
    return summary == null ? "" : summary;
  }

  public boolean hasSummary() {
    return summary != null && !summary.isEmpty();
  }

  public void updateSummary(String summary) {
    if (finalized) {
      throw new IllegalStateException("Summary already finalized for topic: " + topic);
    }
    this.summary = summary;
  }

  /** Replaces the summary with its presentation form. Allowed exactly once. */
  public void finalizeSummary(String presentation) {
    if (finalized) {
      throw new IllegalStateException("Summary already finalized for topic: " + topic);
    }
    this.summary = Objects.requireNonNull(presentation, "presentation");
    this.finalized = true;
  }

  public boolean isFinalized() {
    return finalized;
  }

  public boolean isDelivered() {
    return delivered;
  }

  public void markDelivered() {
    this.delivered = true;
  }
}
