package com.flamingo.ai.doctrine.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.doctrine.exception.PipelineFailureException;
import com.flamingo.ai.doctrine.service.ingest.ExtractionPipeline;
import com.flamingo.ai.doctrine.service.ingest.MetricsSnapshot;
import com.flamingo.ai.doctrine.service.ingest.PipelineRun;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.PipelineResult;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionRunner Tests")
class IngestionRunnerTest {

  private static final MetricsSnapshot METRICS =
      new MetricsSnapshot(1.5, 2, 0, 0, 0, 0, 1.3, 10, 1, 20);

  @Mock private ExtractionPipeline extractionPipeline;
  @Mock private PipelineRun pipelineRun;

  private SimpleMeterRegistry meterRegistry;
  private IngestionRunner runner;
  private List<Chapter> chapters;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    runner =
        new IngestionRunner(extractionPipeline, IngestProgressListener.NOOP, meterRegistry);
    chapters = List.of(Chapter.of(1, null, "one"), Chapter.of(2, null, "two"));
  }

  @Test
  @DisplayName("Should complete the run with the pipeline result")
  void shouldCompleteRun_whenPipelineSucceeds() {
    // Given
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    PipelineResult result =
        new PipelineResult(
            List.of(
                ChapterResult.failed(chapters.get(0), "x"),
                ChapterResult.failed(chapters.get(1), "y")),
            METRICS);
    when(extractionPipeline.start(chapters, 2, IngestProgressListener.NOOP))
        .thenReturn(pipelineRun);
    when(pipelineRun.await()).thenReturn(result);
    when(pipelineRun.isStopped()).thenReturn(false);

    // When
    runner.runAsync(run, chapters);

    // Then
    assertThat(run.getStatus()).isEqualTo(IngestionStatus.COMPLETED);
    assertThat(run.getChapters()).hasSize(2);
    assertThat(run.getMetrics()).isEqualTo(METRICS);
    assertThat(run.getCompletedAt()).isNotNull();
    assertThat(meterRegistry.counter("ingest.runs", "status", "completed").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should mark the run stopped when the pipeline was stopped")
  void shouldMarkStopped_whenPipelineStopped() {
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    when(extractionPipeline.start(chapters, 2, IngestProgressListener.NOOP))
        .thenReturn(pipelineRun);
    when(pipelineRun.await()).thenReturn(new PipelineResult(List.of(), METRICS));
    when(pipelineRun.isStopped()).thenReturn(true);

    runner.runAsync(run, chapters);

    assertThat(run.getStatus()).isEqualTo(IngestionStatus.STOPPED);
  }

  @Test
  @DisplayName("Should record the failure and keep the failed chapters")
  void shouldFailRun_whenEveryChapterFailed() {
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    List<ChapterResult> failed =
        List.of(
            ChapterResult.failed(chapters.get(0), "x"), ChapterResult.failed(chapters.get(1), "y"));
    when(extractionPipeline.start(chapters, 2, IngestProgressListener.NOOP))
        .thenReturn(pipelineRun);
    when(pipelineRun.await())
        .thenThrow(new PipelineFailureException("All 2 chapters failed", failed));
    when(pipelineRun.metrics()).thenReturn(METRICS);

    runner.runAsync(run, chapters);

    assertThat(run.getStatus()).isEqualTo(IngestionStatus.FAILED);
    assertThat(run.getError()).isEqualTo("All 2 chapters failed");
    assertThat(run.getFailedChapters()).isEqualTo(2);
    assertThat(run.getMetrics()).isEqualTo(METRICS);
    assertThat(meterRegistry.counter("ingest.runs", "status", "failed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fail the run on an unexpected error")
  void shouldFailRun_whenPipelineCrashes() {
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    when(extractionPipeline.start(anyList(), anyInt(), any()))
        .thenThrow(new IllegalStateException("executor rejected"));

    runner.runAsync(run, chapters);

    assertThat(run.getStatus()).isEqualTo(IngestionStatus.FAILED);
    assertThat(run.getError()).isEqualTo("executor rejected");
    assertThat(run.getChapters()).isEmpty();
  }

  @Test
  @DisplayName("Should not start the pipeline when a stop arrived first")
  void shouldSkipPipeline_whenStopRequestedBeforeStart() {
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    run.requestStop();

    runner.runAsync(run, chapters);

    assertThat(run.getStatus()).isEqualTo(IngestionStatus.STOPPED);
    verify(extractionPipeline, never()).start(anyList(), anyInt(), any());
  }

  @Test
  @DisplayName("Should forward a stop to the attached pipeline run")
  void shouldForwardStop_toAttachedPipeline() {
    IngestionRun run = new IngestionRun("doc.txt", 2, 2);
    run.attach(pipelineRun);

    assertThat(run.requestStop()).isTrue();

    verify(pipelineRun).stop();
    assertThat(run.isStopRequested()).isTrue();
  }
}
