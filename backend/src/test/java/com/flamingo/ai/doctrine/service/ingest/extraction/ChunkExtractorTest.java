package com.flamingo.ai.doctrine.service.ingest.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.exception.ChunkExtractionException;
import com.flamingo.ai.doctrine.exception.LlmServiceException;
import com.flamingo.ai.doctrine.service.ingest.IngestMetrics;
import com.flamingo.ai.doctrine.service.ingest.PipelineFixtures;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointRecord;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.InMemoryCheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import com.flamingo.ai.doctrine.service.ingest.model.TextChunk;
import com.flamingo.ai.doctrine.service.ingest.ratecontrol.AdaptiveRateController;
import com.flamingo.ai.doctrine.service.llm.GenerationClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChunkExtractorTest {

  private static final String SOURCE =
      "Commanders should keep reserves close to the front so that sudden reversals can be met"
          + " without delay.";
  private static final String HOLD_RESERVES = PipelineFixtures.response("Hold reserves");

  private IngestConfig config;
  private InMemoryCheckpointStore store;
  private IngestMetrics metrics;
  private AdaptiveRateController controller;
  private Chapter chapter;
  private TextChunk chunk;

  @BeforeEach
  void setUp() {
    config = PipelineFixtures.fastConfig();
    store = new InMemoryCheckpointStore();
    metrics = new IngestMetrics(new SimpleMeterRegistry(), 100);
    controller = PipelineFixtures.fixedController(2);
    chapter = Chapter.of(1, "One", SOURCE);
    chunk = new TextChunk(1, 0, SOURCE);
  }

  @Test
  @DisplayName("Should return the parsed result and checkpoint it")
  void shouldReturnResultAndCheckpoint_whenGenerationSucceeds() {
    // Given
    GenerationClient client = (prompt, model, timeout) -> HOLD_RESERVES;
    ChunkExtractor extractor = extractor(client);

    // When
    ExtractionResult result = extractor.extract(chapter, chunk, 1);

    // Then
    assertThat(result.domains()).containsExactly("strategy");
    assertThat(result.principles())
        .extracting(node -> node.asText())
        .containsExactly("Hold reserves");
    CheckpointRecord saved = store.load(chapter.checkpointKey()).orElseThrow();
    assertThat(saved.totalChunks()).isEqualTo(1);
    assertThat(saved.completed()).containsEntry(0, result);
    assertThat(metrics.snapshot().processedChunks()).isEqualTo(1);
    assertThat(metrics.snapshot().errors()).isZero();
  }

  @Test
  @DisplayName("Should retry with the paraphrase prompt after invalid output")
  void shouldRetryWithParaphrasePrompt_whenOutputInvalid() {
    // Given
    List<String> prompts = new CopyOnWriteArrayList<>();
    GenerationClient client =
        (prompt, model, timeout) -> {
          prompts.add(prompt);
          return prompts.size() == 1 ? "not json" : HOLD_RESERVES;
        };

    // When
    ExtractionResult result = extractor(client).extract(chapter, chunk, 1);

    // Then
    assertThat(result.principles()).hasSize(1);
    assertThat(prompts).hasSize(2);
    assertThat(prompts.get(0)).doesNotContain("RETRY MODE");
    assertThat(prompts.get(1)).contains("RETRY MODE");
    assertThat(metrics.snapshot().errors()).isEqualTo(1);
    assertThat(metrics.snapshot().processedChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should drop the chunk after the last invalid attempt")
  void shouldThrow_whenEveryAttemptInvalid() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> {
          calls.incrementAndGet();
          return "{\"domains\": [\"strategy\"], \"principles\": \"oops\"}";
        };

    // When / Then
    assertThatThrownBy(() -> extractor(client).extract(chapter, chunk, 1))
        .isInstanceOf(ChunkExtractionException.class)
        .satisfies(
            e -> {
              ChunkExtractionException failure = (ChunkExtractionException) e;
              assertThat(failure.getChapterIndex()).isEqualTo(1);
              assertThat(failure.getChunkIndex()).isZero();
              assertThat(failure.getReason()).startsWith("invalid model output");
            });
    assertThat(calls).hasValue(2);
    assertThat(metrics.snapshot().droppedChunks()).isEqualTo(1);
    assertThat(metrics.snapshot().errors()).isEqualTo(2);
    assertThat(store.load(chapter.checkpointKey())).isEmpty();
  }

  @Test
  @DisplayName("Should report rate limits to metrics and to the controller")
  void shouldRecordRateLimits_whenModelRateLimited() {
    // Given
    GenerationClient client =
        (prompt, model, timeout) -> {
          throw new LlmServiceException("HTTP 429", true);
        };

    // When / Then
    assertThatThrownBy(() -> extractor(client).extract(chapter, chunk, 1))
        .isInstanceOf(ChunkExtractionException.class)
        .hasMessageContaining("rate limited");
    assertThat(metrics.snapshot().rateLimitHits()).isEqualTo(2);
    assertThat(controller.state().rateLimitHits()).isEqualTo(2);
    assertThat(controller.state().inFlight()).isZero();
  }

  @Test
  @DisplayName("Should wrap unexpected client errors as generation failures")
  void shouldTreatRuntimeErrorsAsGenerationFailures() {
    // Given
    GenerationClient client =
        (prompt, model, timeout) -> {
          throw new IllegalStateException("connection reset");
        };

    // When / Then
    assertThatThrownBy(() -> extractor(client).extract(chapter, chunk, 1))
        .isInstanceOf(ChunkExtractionException.class)
        .hasMessageContaining("generation failed");
    assertThat(controller.state().rateLimitHits()).isZero();
    assertThat(controller.state().inFlight()).isZero();
  }

  @Test
  @DisplayName("Should accept a result that copies source text and flag it")
  void shouldFlagVerbatimOverlap_whenItemCopiesSource() {
    // Given
    String copied =
        "keep reserves close to the front so that sudden reversals can be met without delay";
    GenerationClient client = (prompt, model, timeout) -> PipelineFixtures.response(copied);

    // When
    ExtractionResult result = extractor(client).extract(chapter, chunk, 1);

    // Then
    assertThat(result.verbatimWarning()).startsWith("Verbatim phrase detected");
    assertThat(metrics.snapshot().verbatimWarnings()).isEqualTo(1);
    assertThat(store.load(chapter.checkpointKey()).orElseThrow().completed().get(0))
        .isEqualTo(result);
  }

  @Test
  @DisplayName("Should still return the result when the checkpoint write fails")
  void shouldReturnResult_whenCheckpointWriteFails() {
    // Given
    CheckpointStore failingStore = mock(CheckpointStore.class);
    doThrow(new UncheckedIOException(new IOException("disk full")))
        .when(failingStore)
        .markCompleted(anyString(), anyInt(), anyInt(), any());
    GenerationClient client = (prompt, model, timeout) -> HOLD_RESERVES;
    ChunkExtractor extractor =
        PipelineFixtures.extractor(client, controller, failingStore, metrics, config);

    // When
    ExtractionResult result = extractor.extract(chapter, chunk, 1);

    // Then
    assertThat(result.principles()).hasSize(1);
    assertThat(metrics.snapshot().errors()).isEqualTo(1);
    assertThat(metrics.snapshot().processedChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should release the permit after every attempt")
  void shouldReleasePermit_afterAttempts() {
    // Given
    GenerationClient client = (prompt, model, timeout) -> "garbage";

    // When
    assertThatThrownBy(() -> extractor(client).extract(chapter, chunk, 1))
        .isInstanceOf(ChunkExtractionException.class);

    // Then
    assertThat(controller.state().inFlight()).isZero();
  }

  @Test
  @DisplayName("Should double the back-off per attempt up to the cap")
  void shouldDoubleBackoff_upToCap() {
    Duration base = Duration.ofSeconds(2);

    assertThat(ChunkExtractor.backoffFor(base, 1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(ChunkExtractor.backoffFor(base, 2)).isEqualTo(Duration.ofSeconds(4));
    assertThat(ChunkExtractor.backoffFor(base, 4)).isEqualTo(Duration.ofSeconds(16));
    assertThat(ChunkExtractor.backoffFor(base, 6)).isEqualTo(ChunkExtractor.MAX_BACKOFF);
    assertThat(ChunkExtractor.backoffFor(base, 40)).isEqualTo(ChunkExtractor.MAX_BACKOFF);
  }

  private ChunkExtractor extractor(GenerationClient client) {
    return PipelineFixtures.extractor(client, controller, store, metrics, config);
  }
}
