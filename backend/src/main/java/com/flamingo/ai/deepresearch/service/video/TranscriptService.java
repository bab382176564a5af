package com.flamingo.ai.deepresearch.service.video;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.TranscriptTimeoutException;
import com.flamingo.ai.deepresearch.exception.TranscriptUnavailableException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs transcript fetches on the transcript executor under a deadline so a hung fetch cannot stall
 * the research run. A fetch that misses its deadline is cancelled, which interrupts its worker
 * thread.
 */
@Service
@Slf4j
public class TranscriptService {

  private final TranscriptFetcher transcriptFetcher;
  private final AsyncTaskExecutor transcriptExecutor;
  private final Duration timeout;

  public TranscriptService(
      TranscriptFetcher transcriptFetcher,
      @Qualifier("transcriptExecutor") AsyncTaskExecutor transcriptExecutor,
      ResearchConfig researchConfig) {
    this.transcriptFetcher = transcriptFetcher;
    this.transcriptExecutor = transcriptExecutor;
    this.timeout = Duration.ofSeconds(researchConfig.getYoutube().getTranscriptTimeoutSeconds());
  }

  /**
   * Fetches a transcript, waiting at most the configured timeout.
   *
   * @throws TranscriptTimeoutException when the deadline passes
   * @throws TranscriptUnavailableException when the fetch itself fails or cannot be scheduled
   */
  public String fetch(String videoId) {
    Future<String> future;
    try {
      future = transcriptExecutor.submit(() -> transcriptFetcher.fetchTranscript(videoId));
    } catch (TaskRejectedException e) {
      throw new TranscriptUnavailableException(videoId, e);
    }

    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TranscriptTimeoutException(videoId, timeout);
    } catch (ExecutionException e) {
      throw new TranscriptUnavailableException(videoId, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new TranscriptUnavailableException(videoId, e);
    }
  }
}
