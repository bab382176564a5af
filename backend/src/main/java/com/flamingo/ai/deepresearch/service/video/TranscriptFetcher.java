package com.flamingo.ai.deepresearch.service.video;

/** Fetches the plain-text transcript of a video. Implementations may block for a long time. */
public interface TranscriptFetcher {

  /**
   * @param videoId YouTube video id
   * @return transcript segments joined by single spaces
   * @throws Exception when no transcript can be retrieved
   */
  String fetchTranscript(String videoId) throws Exception;
}
