package com.flamingo.ai.doctrine.service.ingest;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.chunking.ChapterChunker;
import com.flamingo.ai.doctrine.service.ingest.extraction.ChunkExtractor;
import com.flamingo.ai.doctrine.service.ingest.extraction.DoctrinePromptBuilder;
import com.flamingo.ai.doctrine.service.ingest.extraction.ExtractionResultParser;
import com.flamingo.ai.doctrine.service.ingest.extraction.VerbatimOverlapDetector;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import com.flamingo.ai.doctrine.service.ingest.ratecontrol.AdaptiveRateController;
import com.flamingo.ai.doctrine.service.llm.GenerationClient;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the extraction pipeline over a list of chapters.
 *
 * <p>Every run gets its own rate controller, metrics collector and worker pool. The checkpoint
 * store is shared, so a run over chapters that were already extracted makes no generation calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionPipeline {

  private final GenerationClient generationClient;
  private final CheckpointStore checkpointStore;
  private final ChapterChunker chapterChunker;
  private final DoctrinePromptBuilder promptBuilder;
  private final ExtractionResultParser resultParser;
  private final VerbatimOverlapDetector verbatimDetector;
  private final IngestConfig ingestConfig;
  private final MeterRegistry meterRegistry;

  private final Set<AdaptiveRateController> activeControllers = ConcurrentHashMap.newKeySet();

  /**
   * Processes the chapters and blocks until every chapter has a result.
   *
   * @param chapters chapters in document order
   * @param numWorkers number of chapter worker threads
   * @return results in input order plus final metrics
   * @throws com.flamingo.ai.doctrine.exception.PipelineFailureException if every chapter failed
   */
  @Timed(value = "ingest.pipeline.run", description = "Time to run the extraction pipeline")
  public PipelineResult run(List<Chapter> chapters, int numWorkers) {
    return start(chapters, numWorkers, IngestProgressListener.NOOP).await();
  }

  public PipelineRun start(
      List<Chapter> chapters, int numWorkers, IngestProgressListener listener) {
    validateWorkers(numWorkers);
    return start(
        chapters,
        numWorkers,
        AdaptiveRateController.fromConfig(ingestConfig.getRateControl(), numWorkers),
        listener);
  }

  /** Starts a run with a caller-supplied rate controller. */
  public PipelineRun start(
      List<Chapter> chapters,
      int numWorkers,
      AdaptiveRateController rateController,
      IngestProgressListener listener) {
    validateWorkers(numWorkers);
    IngestMetrics metrics =
        new IngestMetrics(meterRegistry, ingestConfig.getMetrics().getLatencyWindow());
    registerGauges();
    activeControllers.add(rateController);

    ChunkExtractor extractor =
        new ChunkExtractor(
            generationClient,
            rateController,
            checkpointStore,
            promptBuilder,
            resultParser,
            verbatimDetector,
            metrics,
            ingestConfig.getExtraction(),
            ingestConfig.getRateControl().getAcquireTimeout());
    ChapterProcessor processor =
        new ChapterProcessor(
            chapterChunker, extractor, checkpointStore, new ChapterAggregator(), metrics);

    PipelineRun run =
        new PipelineRun(
            chapters,
            numWorkers,
            processor,
            rateController,
            metrics,
            ingestConfig.getPipeline(),
            listener,
            () -> activeControllers.remove(rateController));
    run.begin();
    return run;
  }

  // Registration is idempotent, the registry returns the existing gauge
  private void registerGauges() {
    Gauge.builder(
            "ingest.rate_control.concurrency",
            activeControllers,
            controllers ->
                controllers.stream().mapToInt(AdaptiveRateController::concurrency).sum())
        .description("Generation concurrency limit summed over active runs")
        .register(meterRegistry);
    Gauge.builder("ingest.runs.active", activeControllers, Set::size)
        .description("Pipeline runs with live chapter workers")
        .register(meterRegistry);
  }

  /** Rate controllers of runs whose workers are still alive. */
  Set<AdaptiveRateController> activeControllers() {
    return Set.copyOf(activeControllers);
  }

  private static void validateWorkers(int numWorkers) {
    if (numWorkers < 1) {
      throw new IllegalArgumentException("numWorkers must be at least 1: " + numWorkers);
    }
  }
}
