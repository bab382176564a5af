package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when a video transcript cannot be fetched for reasons other than a timeout. */
public class TranscriptUnavailableException extends RuntimeException {

  private final String videoId;

  public TranscriptUnavailableException(String videoId, Throwable cause) {
    super("Transcript not available for video " + videoId + ": " + cause.getMessage(), cause);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
