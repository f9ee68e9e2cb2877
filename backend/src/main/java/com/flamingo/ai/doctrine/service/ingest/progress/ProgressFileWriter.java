package com.flamingo.ai.doctrine.service.ingest.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.AtomicFileWriter;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors run progress into a small JSON file that external tools can poll:
 *
 * <pre>{"phase":"extraction","message":"...","current":3,"total":10,"percent":30.0,
 * "status":"running","timestamp":"..."}</pre>
 *
 * <p>Write failures are logged and otherwise ignored; progress reporting never fails a run.
 *
 * <p>Each run reports through its own {@link #forRun(String)} copy, which keeps separate chapter
 * counts and adds a {@code run_id} field. Overlapping runs share the file, so it shows whichever
 * run reported last.
 */
@Slf4j
public class ProgressFileWriter implements IngestProgressListener {

  static final String PHASE = "extraction";

  private final Path file;
  private final ObjectMapper objectMapper;
  private final String runId;
  private final Object fileLock;
  private final AtomicInteger finishedChapters = new AtomicInteger();
  private volatile int totalChapters;

  public ProgressFileWriter(Path file, ObjectMapper objectMapper) {
    this(file, objectMapper, null, new Object());
  }

  private ProgressFileWriter(Path file, ObjectMapper objectMapper, String runId, Object fileLock) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.runId = runId;
    this.fileLock = fileLock;
  }

  @Override
  public IngestProgressListener forRun(String runId) {
    return new ProgressFileWriter(file, objectMapper, runId, fileLock);
  }

  @Override
  public void runStarted(int totalChapters) {
    this.totalChapters = totalChapters;
    finishedChapters.set(0);
    write("Starting extraction of " + totalChapters + " chapters", 0, "running");
  }

  @Override
  public void chapterStarted(Chapter chapter, int totalChunks) {
    write(
        "Chapter " + chapter.chapterIndex() + " started (" + totalChunks + " chunks)",
        finishedChapters.get(),
        "running");
  }

  @Override
  public void chapterFinished(ChapterResult result) {
    int done = finishedChapters.incrementAndGet();
    write(
        "Chapter " + result.chapterIndex() + " finished: " + result.status().value(),
        done,
        "running");
  }

  @Override
  public void runFinished(PipelineResult result) {
    write(
        "Extraction finished, " + result.failedChapters() + " chapters failed",
        result.chapters().size(),
        "completed");
  }

  @Override
  public void runFailed(String reason) {
    write(reason, finishedChapters.get(), "failed");
  }

  private void write(String message, int current, String status) {
    int total = totalChapters;
    Map<String, Object> progress = new LinkedHashMap<>();
    if (runId != null) {
      progress.put("run_id", runId);
    }
    progress.put("phase", PHASE);
    progress.put("message", message);
    progress.put("current", current);
    progress.put("total", total);
    progress.put("percent", total > 0 ? Math.round(current * 1000.0 / total) / 10.0 : 0.0);
    progress.put("status", status);
    progress.put("timestamp", Instant.now().toString());
    synchronized (fileLock) {
      try {
        AtomicFileWriter.write(file, objectMapper.writeValueAsBytes(progress));
      } catch (IOException e) {
        log.warn("Could not write progress file {}: {}", file, e.getMessage());
      }
    }
  }
}
