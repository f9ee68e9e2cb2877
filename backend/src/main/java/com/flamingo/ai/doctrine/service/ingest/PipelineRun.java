package com.flamingo.ai.doctrine.service.ingest;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.exception.PipelineFailureException;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import com.flamingo.ai.doctrine.service.ingest.ratecontrol.AdaptiveRateController;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Handle for a running pipeline.
 *
 * <p>A producer thread feeds chapters into a bounded queue followed by one end marker per worker.
 * Each worker takes one chapter at a time and stores the result by input position. {@link #await()}
 * restores input order and fills in a failed result for any chapter that produced none.
 */
@Slf4j
public class PipelineRun {

  private static final QueueItem END = new QueueItem(-1, null);

  private final List<Chapter> chapters;
  private final int numWorkers;
  private final ChapterProcessor processor;
  private final AdaptiveRateController rateController;
  private final IngestMetrics metrics;
  private final IngestConfig.Pipeline config;
  private final IngestProgressListener listener;
  private final Runnable onWorkersDone;

  private final BlockingQueue<QueueItem> queue;
  private final ConcurrentMap<Integer, ChapterResult> results = new ConcurrentHashMap<>();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final AtomicBoolean timedOut = new AtomicBoolean();
  private final ExecutorService workers;
  private final AtomicInteger liveWorkers;
  private final Thread producer;

  private PipelineResult outcome;
  private PipelineFailureException failure;

  PipelineRun(
      List<Chapter> chapters,
      int numWorkers,
      ChapterProcessor processor,
      AdaptiveRateController rateController,
      IngestMetrics metrics,
      IngestConfig.Pipeline config,
      IngestProgressListener listener,
      Runnable onWorkersDone) {
    this.chapters = List.copyOf(chapters);
    this.numWorkers = numWorkers;
    this.processor = processor;
    this.rateController = rateController;
    this.metrics = metrics;
    this.config = config;
    this.listener = listener;
    this.onWorkersDone = onWorkersDone;
    this.liveWorkers = new AtomicInteger(numWorkers);
    this.queue = new LinkedBlockingQueue<>(Math.max(1, config.getQueueCapacity()));
    this.workers =
        Executors.newFixedThreadPool(numWorkers, new CustomizableThreadFactory("chapter-worker-"));
    this.producer = new CustomizableThreadFactory("chapter-producer-").newThread(this::produce);
  }

  void begin() {
    log.info("Pipeline started: {} chapters, {} workers", chapters.size(), numWorkers);
    listener.runStarted(chapters.size());
    for (int i = 0; i < numWorkers; i++) {
      workers.submit(this::work);
    }
    workers.shutdown();
    producer.start();
  }

  /** Stops handing out chapters. Chapters already being processed run to completion. */
  public void stop() {
    if (stopped.compareAndSet(false, true)) {
      log.info("Stop requested, {} of {} chapters finished", results.size(), chapters.size());
    }
  }

  public boolean isStopped() {
    return stopped.get();
  }

  public int totalChapters() {
    return chapters.size();
  }

  public int finishedChapters() {
    return results.size();
  }

  public AdaptiveRateController rateController() {
    return rateController;
  }

  public MetricsSnapshot metrics() {
    return metrics.snapshot();
  }

  /**
   * Waits for the workers and returns the ordered results. Repeated calls return the same outcome.
   *
   * @throws PipelineFailureException when every chapter failed and the run was not stopped
   */
  public synchronized PipelineResult await() {
    if (outcome == null && failure == null) {
      collect();
    }
    if (failure != null) {
      throw failure;
    }
    return outcome;
  }

  private void collect() {
    try {
      if (!workers.awaitTermination(config.getResultsTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.error(
            "Workers did not finish within {}s, collecting partial results",
            config.getResultsTimeout().toSeconds());
        abort();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for chapter workers");
      abort();
    }

    List<ChapterResult> ordered = new ArrayList<>(chapters.size());
    for (int position = 0; position < chapters.size(); position++) {
      ChapterResult result = results.get(position);
      if (result == null) {
        Chapter chapter = chapters.get(position);
        String reason =
            stopped.get() ? "run stopped before chapter was processed" : "no result collected";
        if (!stopped.get()) {
          log.error("Chapter {} produced no result", chapter.chapterIndex());
        }
        result = ChapterResult.failed(chapter, reason);
      }
      ordered.add(result);
    }

    PipelineResult pipelineResult = new PipelineResult(ordered, metrics.snapshot());
    long failed = pipelineResult.failedChapters();
    if (!ordered.isEmpty() && failed == ordered.size() && !stopped.get()) {
      String message = "All " + failed + " chapters failed";
      log.error("Pipeline failed: {}", message);
      listener.runFailed(message);
      failure = new PipelineFailureException(message, ordered);
      return;
    }
    if (failed > 0) {
      log.warn("Pipeline finished with {} of {} chapters failed", failed, ordered.size());
    } else {
      log.info("Pipeline finished: {} chapters", ordered.size());
    }
    listener.runFinished(pipelineResult);
    outcome = pipelineResult;
  }

  // Halts producer and workers without counting as a user stop
  private void abort() {
    timedOut.set(true);
    List<Runnable> neverStarted = workers.shutdownNow();
    neverStarted.forEach(task -> workerExited());
    producer.interrupt();
  }

  private void produce() {
    long pollMillis = config.getPollInterval().toMillis();
    try {
      for (int position = 0; position < chapters.size(); position++) {
        QueueItem item = new QueueItem(position, chapters.get(position));
        if (!offer(item, pollMillis)) {
          return;
        }
      }
      for (int i = 0; i < numWorkers; i++) {
        if (!offer(END, pollMillis)) {
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  // False once the run is stopped or timed out
  private boolean offer(QueueItem item, long pollMillis) throws InterruptedException {
    while (!halted()) {
      if (queue.offer(item, pollMillis, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  private boolean halted() {
    return stopped.get() || timedOut.get();
  }

  private void workerExited() {
    if (liveWorkers.decrementAndGet() == 0) {
      onWorkersDone.run();
    }
  }

  private void work() {
    try {
      pollChapters();
    } finally {
      workerExited();
    }
  }

  private void pollChapters() {
    long pollMillis = config.getPollInterval().toMillis();
    while (!halted()) {
      QueueItem item;
      try {
        item = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (item == null) {
        continue;
      }
      if (item == END) {
        return;
      }
      results.put(item.position(), processSafely(item.chapter()));
    }
  }

  private ChapterResult processSafely(Chapter chapter) {
    try {
      return processor.process(chapter, listener);
    } catch (RuntimeException e) {
      log.error("Chapter {} failed unexpectedly: {}", chapter.chapterIndex(), e.getMessage(), e);
      ChapterResult failed = ChapterResult.failed(chapter, "unexpected error: " + e.getMessage());
      listener.chapterFinished(failed);
      return failed;
    }
  }

  private record QueueItem(int position, Chapter chapter) {}
}
