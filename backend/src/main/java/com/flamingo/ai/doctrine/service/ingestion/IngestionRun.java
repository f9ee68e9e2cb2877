package com.flamingo.ai.doctrine.service.ingestion;

import com.flamingo.ai.doctrine.service.ingest.MetricsSnapshot;
import com.flamingo.ai.doctrine.service.ingest.PipelineRun;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;

/** Tracks one asynchronous ingestion run. State transitions are synchronized on the instance. */
@Getter
public class IngestionRun {

  private final String id = UUID.randomUUID().toString();
  private final String documentName;
  private final int numWorkers;
  private final int totalChapters;
  private final Instant createdAt = Instant.now();

  private volatile IngestionStatus status = IngestionStatus.RUNNING;
  private volatile Instant completedAt;
  private volatile String error;
  private volatile List<ChapterResult> chapters = List.of();
  private volatile MetricsSnapshot metrics;
  private volatile boolean stopRequested;

  @Getter(AccessLevel.NONE)
  private PipelineRun pipelineRun;

  public IngestionRun(String documentName, int numWorkers, int totalChapters) {
    this.documentName = documentName;
    this.numWorkers = numWorkers;
    this.totalChapters = totalChapters;
  }

  /** Chapters with a result so far. */
  public synchronized int getFinishedChapters() {
    if (status.isTerminal()) {
      return chapters.size();
    }
    return pipelineRun == null ? 0 : pipelineRun.finishedChapters();
  }

  public synchronized MetricsSnapshot getMetrics() {
    if (metrics == null && pipelineRun != null) {
      return pipelineRun.metrics();
    }
    return metrics;
  }

  public synchronized long getFailedChapters() {
    return chapters.stream().filter(ChapterResult::isFailed).count();
  }

  synchronized void attach(PipelineRun run) {
    this.pipelineRun = run;
    if (stopRequested) {
      run.stop();
    }
  }

  /** Requests a stop. Returns false when the run had already finished. */
  synchronized boolean requestStop() {
    if (status.isTerminal()) {
      return false;
    }
    stopRequested = true;
    if (pipelineRun != null) {
      pipelineRun.stop();
    }
    return true;
  }

  synchronized void complete(PipelineResult result, boolean stopped) {
    this.chapters = result.chapters();
    this.metrics = result.metrics();
    finish(stopped ? IngestionStatus.STOPPED : IngestionStatus.COMPLETED, null);
  }

  synchronized void fail(String error, List<ChapterResult> chapters) {
    if (pipelineRun != null) {
      this.metrics = pipelineRun.metrics();
    }
    this.chapters = List.copyOf(chapters);
    finish(IngestionStatus.FAILED, error);
  }

  synchronized void markStopped() {
    finish(IngestionStatus.STOPPED, null);
  }

  private void finish(IngestionStatus status, String error) {
    this.status = status;
    this.error = error;
    this.completedAt = Instant.now();
    this.pipelineRun = null;
  }
}
