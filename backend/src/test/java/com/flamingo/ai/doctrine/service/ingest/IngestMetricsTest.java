package com.flamingo.ai.doctrine.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestMetricsTest {

  private SimpleMeterRegistry registry;
  private IngestMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new IngestMetrics(registry, 3);
  }

  @Test
  void shouldCountEventsInSnapshotAndRegistry() {
    metrics.recordProcessed();
    metrics.recordProcessed();
    metrics.recordDropped();
    metrics.recordRateLimit();
    metrics.recordError();
    metrics.recordError();
    metrics.recordVerbatimWarning();

    MetricsSnapshot snapshot = metrics.snapshot();

    assertThat(snapshot.processedChunks()).isEqualTo(2);
    assertThat(snapshot.droppedChunks()).isEqualTo(1);
    assertThat(snapshot.rateLimitHits()).isEqualTo(1);
    assertThat(snapshot.errors()).isEqualTo(2);
    assertThat(snapshot.verbatimWarnings()).isEqualTo(1);
    assertThat(snapshot.elapsedSeconds()).isPositive();
    assertThat(snapshot.throughputChunksPerSec()).isPositive();
    assertThat(registry.counter("ingest.chunks.processed").count()).isEqualTo(2.0);
    assertThat(registry.counter("ingest.errors").count()).isEqualTo(2.0);
  }

  @Test
  void shouldAverageOnlyTheMostRecentLatencies() {
    metrics.recordGenerationLatency(Duration.ofMillis(1000));
    metrics.recordGenerationLatency(Duration.ofMillis(10));
    metrics.recordGenerationLatency(Duration.ofMillis(20));
    metrics.recordGenerationLatency(Duration.ofMillis(30));

    assertThat(metrics.generationWindowCount()).isEqualTo(3);
    assertThat(metrics.snapshot().avgGenerationLatencyMs()).isEqualTo(20.0);
    assertThat(registry.timer("ingest.generation.latency").count()).isEqualTo(4);
  }

  @Test
  void shouldReportZeroAverages_whenNothingRecorded() {
    MetricsSnapshot snapshot = metrics.snapshot();

    assertThat(snapshot.avgGenerationLatencyMs()).isZero();
    assertThat(snapshot.avgCheckpointLatencyMs()).isZero();
    assertThat(snapshot.avgChapterLatencyMs()).isZero();
  }

  @Test
  void shouldTrackCheckpointAndChapterLatencySeparately() {
    metrics.recordCheckpointLatency(Duration.ofMillis(4));
    metrics.recordChapterLatency(Duration.ofMillis(400));

    MetricsSnapshot snapshot = metrics.snapshot();

    assertThat(snapshot.avgCheckpointLatencyMs()).isEqualTo(4.0);
    assertThat(snapshot.avgChapterLatencyMs()).isEqualTo(400.0);
  }
}
