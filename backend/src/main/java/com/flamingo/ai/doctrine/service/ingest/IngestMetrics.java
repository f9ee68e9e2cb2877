package com.flamingo.ai.doctrine.service.ingest;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run counters and latency windows. Every counter and timer is mirrored into the Micrometer
 * registry so process-wide totals are visible through the actuator.
 *
 * <p>Latency windows keep only the most recent samples.
 */
public class IngestMetrics {

  private final long startNanos = System.nanoTime();

  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong rateLimitHits = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong verbatimWarnings = new AtomicLong();

  private final LatencyWindow generationLatencies;
  private final LatencyWindow checkpointLatencies;
  private final LatencyWindow chapterLatencies;

  private final Counter processedCounter;
  private final Counter droppedCounter;
  private final Counter rateLimitCounter;
  private final Counter errorCounter;
  private final Counter verbatimCounter;
  private final Timer generationTimer;
  private final Timer checkpointTimer;
  private final Timer chapterTimer;

  public IngestMetrics(MeterRegistry registry, int windowSize) {
    int capacity = Math.max(1, windowSize);
    this.generationLatencies = new LatencyWindow(capacity);
    this.checkpointLatencies = new LatencyWindow(capacity);
    this.chapterLatencies = new LatencyWindow(capacity);

    this.processedCounter = registry.counter("ingest.chunks.processed");
    this.droppedCounter = registry.counter("ingest.chunks.dropped");
    this.rateLimitCounter = registry.counter("ingest.rate_limit.hits");
    this.errorCounter = registry.counter("ingest.errors");
    this.verbatimCounter = registry.counter("ingest.verbatim.warnings");
    this.generationTimer = registry.timer("ingest.generation.latency");
    this.checkpointTimer = registry.timer("ingest.checkpoint.write");
    this.chapterTimer = registry.timer("ingest.chapter.latency");
  }

  public void recordProcessed() {
    processed.incrementAndGet();
    processedCounter.increment();
  }

  public void recordDropped() {
    dropped.incrementAndGet();
    droppedCounter.increment();
  }

  public void recordRateLimit() {
    rateLimitHits.incrementAndGet();
    rateLimitCounter.increment();
  }

  public void recordError() {
    errors.incrementAndGet();
    errorCounter.increment();
  }

  public void recordVerbatimWarning() {
    verbatimWarnings.incrementAndGet();
    verbatimCounter.increment();
  }

  public void recordGenerationLatency(Duration latency) {
    generationLatencies.add(latency);
    generationTimer.record(latency);
  }

  public void recordCheckpointLatency(Duration latency) {
    checkpointLatencies.add(latency);
    checkpointTimer.record(latency);
  }

  public void recordChapterLatency(Duration latency) {
    chapterLatencies.add(latency);
    chapterTimer.record(latency);
  }

  public MetricsSnapshot snapshot() {
    double elapsed = (System.nanoTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
    long processedCount = processed.get();
    return new MetricsSnapshot(
        elapsed,
        processedCount,
        dropped.get(),
        rateLimitHits.get(),
        errors.get(),
        verbatimWarnings.get(),
        elapsed > 0 ? processedCount / elapsed : 0.0,
        generationLatencies.averageMillis(),
        checkpointLatencies.averageMillis(),
        chapterLatencies.averageMillis());
  }

  int generationWindowCount() {
    return generationLatencies.size();
  }

  private static final class LatencyWindow {

    private final int capacity;
    private final Deque<Duration> samples = new ArrayDeque<>();

    private LatencyWindow(int capacity) {
      this.capacity = capacity;
    }

    synchronized void add(Duration latency) {
      samples.addLast(latency);
      if (samples.size() > capacity) {
        samples.removeFirst();
      }
    }

    synchronized int size() {
      return samples.size();
    }

    synchronized double averageMillis() {
      return samples.stream().mapToDouble(d -> d.toNanos() / 1_000_000.0).average().orElse(0.0);
    }
  }
}
