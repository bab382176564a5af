package com.flamingo.ai.deepresearch.exception;

import java.time.Duration;

/** Exception thrown when a video transcript is not fetched before its deadline. */
public class TranscriptTimeoutException extends RuntimeException {

  private final String videoId;

  public TranscriptTimeoutException(String videoId, Duration timeout) {
    super("Transcript for video " + videoId + " not retrieved within " + timeout.toSeconds() + "s");
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
