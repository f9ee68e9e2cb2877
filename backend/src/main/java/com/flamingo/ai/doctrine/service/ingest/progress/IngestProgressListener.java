package com.flamingo.ai.doctrine.service.ingest.progress;

import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;

/**
 * Callbacks fired while a pipeline run progresses. Chapter callbacks arrive on worker threads, so
 * implementations must be thread-safe and must not throw.
 */
public interface IngestProgressListener {

  IngestProgressListener NOOP = new IngestProgressListener() {};

  /** Listener for a single run. Stateless listeners return themselves. */
  default IngestProgressListener forRun(String runId) {
    return this;
  }

  default void runStarted(int totalChapters) {}

  default void chapterStarted(Chapter chapter, int totalChunks) {}

  default void chunkCompleted(Chapter chapter, int chunkIndex, int doneChunks, int totalChunks) {}

  default void chapterFinished(ChapterResult result) {}

  default void runFinished(PipelineResult result) {}

  default void runFailed(String reason) {}
}
