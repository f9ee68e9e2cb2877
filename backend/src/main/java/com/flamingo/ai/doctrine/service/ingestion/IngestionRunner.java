package com.flamingo.ai.doctrine.service.ingestion;

import com.flamingo.ai.doctrine.exception.PipelineFailureException;
import com.flamingo.ai.doctrine.service.ingest.ExtractionPipeline;
import com.flamingo.ai.doctrine.service.ingest.PipelineRun;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Executes ingestion runs on the ingestion executor. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionRunner {

  private final ExtractionPipeline extractionPipeline;
  private final IngestProgressListener progressListener;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the pipeline for a registered run and records the outcome on it.
   *
   * @param run the run to execute
   * @param chapters chapters to extract
   */
  @Async("ingestionExecutor")
  @Timed(value = "ingest.run", description = "Time to complete an ingestion run")
  public void runAsync(IngestionRun run, List<Chapter> chapters) {
    if (run.isStopRequested()) {
      log.info("Run {} stopped before it started", run.getId());
      run.markStopped();
      meterRegistry.counter("ingest.runs", "status", "stopped").increment();
      return;
    }

    try {
      log.info(
          "Run {} started for {}: {} chapters, {} workers",
          run.getId(),
          run.getDocumentName(),
          chapters.size(),
          run.getNumWorkers());
      PipelineRun pipelineRun =
          extractionPipeline.start(
              chapters, run.getNumWorkers(), progressListener.forRun(run.getId()));
      run.attach(pipelineRun);
      PipelineResult result = pipelineRun.await();
      run.complete(result, pipelineRun.isStopped());
      log.info(
          "Run {} {}: {} of {} chapters failed",
          run.getId(),
          run.getStatus().name().toLowerCase(),
          result.failedChapters(),
          chapters.size());
    } catch (PipelineFailureException e) {
      log.error("Run {} failed: {}", run.getId(), e.getMessage());
      run.fail(e.getMessage(), e.getResults());
    } catch (RuntimeException e) {
      log.error("Run {} crashed: {}", run.getId(), e.getMessage(), e);
      run.fail(e.getMessage(), List.of());
    }
    meterRegistry
        .counter("ingest.runs", "status", run.getStatus().name().toLowerCase())
        .increment();
  }
}
