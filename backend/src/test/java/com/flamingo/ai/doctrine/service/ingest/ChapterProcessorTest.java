package com.flamingo.ai.doctrine.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.FileCheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.InMemoryCheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.chunking.ChapterChunker;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterStatus;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import com.flamingo.ai.doctrine.service.llm.GenerationClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChapterProcessorTest {

  private IngestConfig config;
  private InMemoryCheckpointStore store;
  private IngestMetrics metrics;
  private Chapter chapter;
  private int totalChunks;

  @BeforeEach
  void setUp() {
    config = PipelineFixtures.fastConfig();
    store = new InMemoryCheckpointStore();
    metrics = new IngestMetrics(new SimpleMeterRegistry(), 100);
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 6; i++) {
      text.append("Paragraph ").append(i).append(" ").append("word ".repeat(20)).append("\n\n");
    }
    chapter = Chapter.of(1, "Opening", text.toString());
    totalChunks = new ChapterChunker(config.getChunking().getMaxChars()).chunk(chapter).size();
  }

  @Test
  @DisplayName("Should extract every chunk and aggregate")
  void shouldExtractAllChunks_whenNoCheckpoint() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> PipelineFixtures.response("P" + calls.incrementAndGet());

    // When
    ChapterResult result = processor(client).process(chapter);

    // Then
    assertThat(totalChunks).isGreaterThan(1);
    assertThat(calls).hasValue(totalChunks);
    assertThat(result.status()).isEqualTo(ChapterStatus.OK);
    assertThat(result.totalChunks()).isEqualTo(totalChunks);
    assertThat(result.completedChunks()).isEqualTo(totalChunks);
    assertThat(result.principles()).hasSize(totalChunks);
    assertThat(store.isCompleted(chapter.checkpointKey())).isTrue();
    assertThat(metrics.snapshot().avgChapterLatencyMs()).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  @DisplayName("Should not call the model when the checkpoint is complete")
  void shouldSkipGeneration_whenCheckpointComplete() {
    // Given
    for (int i = 0; i < totalChunks; i++) {
      store.markCompleted(chapter.checkpointKey(), totalChunks, i, result("Saved " + i));
    }
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> {
          calls.incrementAndGet();
          return PipelineFixtures.response("fresh");
        };

    // When
    ChapterResult result = processor(client).process(chapter);

    // Then
    assertThat(calls).hasValue(0);
    assertThat(result.status()).isEqualTo(ChapterStatus.OK);
    assertThat(result.principles()).hasSize(totalChunks);
  }

  @Test
  @DisplayName("Should only extract chunks missing from the checkpoint")
  void shouldResumePartialCheckpoint() {
    // Given
    store.markCompleted(chapter.checkpointKey(), totalChunks, 0, result("Saved 0"));
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> PipelineFixtures.response("P" + calls.incrementAndGet());

    // When
    ChapterResult result = processor(client).process(chapter);

    // Then
    assertThat(calls).hasValue(totalChunks - 1);
    assertThat(result.principles().get(0).asText()).isEqualTo("Saved 0");
    assertThat(result.completedChunks()).isEqualTo(totalChunks);
  }

  @Test
  @DisplayName("Should ignore a checkpoint recorded with a different chunk count")
  void shouldIgnoreStaleCheckpoint() {
    // Given
    store.markCompleted(chapter.checkpointKey(), totalChunks + 5, 0, result("Stale"));
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> PipelineFixtures.response("P" + calls.incrementAndGet());

    // When
    ChapterResult result = processor(client).process(chapter);

    // Then
    assertThat(calls).hasValue(totalChunks);
    assertThat(result.principles()).extracting(node -> node.asText()).doesNotContain("Stale");
    assertThat(store.load(chapter.checkpointKey()).orElseThrow().totalChunks())
        .isEqualTo(totalChunks);
  }

  @Test
  @DisplayName("Should re-extract chunks when the checkpoint file holds null entries")
  void shouldRecover_whenCheckpointFileHasNullEntry(@TempDir Path dir) throws Exception {
    // Given
    FileCheckpointStore fileStore = new FileCheckpointStore(dir, PipelineFixtures.MAPPER);
    Files.writeString(
        fileStore.pathFor(chapter.checkpointKey()),
        "{\"total_chunks\": " + totalChunks + ", \"completed\": {\"0\": null}}",
        StandardCharsets.UTF_8);
    AtomicInteger calls = new AtomicInteger();
    GenerationClient client =
        (prompt, model, timeout) -> PipelineFixtures.response("P" + calls.incrementAndGet());

    // When
    ChapterResult result =
        PipelineFixtures.processor(client, fileStore, metrics, config).process(chapter);

    // Then
    assertThat(result.status()).isEqualTo(ChapterStatus.OK);
    assertThat(calls).hasValue(totalChunks);
    assertThat(fileStore.isCompleted(chapter.checkpointKey())).isTrue();
  }

  @Test
  @DisplayName("Should keep going when one chunk fails")
  void shouldReportPartial_whenOneChunkFails() {
    // Given
    GenerationClient client =
        (prompt, model, timeout) ->
            prompt.contains("Paragraph 0 ") ? "broken" : PipelineFixtures.response("ok");

    // When
    ChapterResult result = processor(client).process(chapter);

    // Then
    assertThat(result.status()).isEqualTo(ChapterStatus.PARTIAL);
    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).chunkIndex()).isZero();
    assertThat(result.completedChunks()).isEqualTo(totalChunks - 1);
    assertThat(metrics.snapshot().droppedChunks()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should fail a chapter with no text")
  void shouldFail_whenChapterEmpty() {
    GenerationClient client = (prompt, model, timeout) -> PipelineFixtures.response("never");

    ChapterResult result = processor(client).process(Chapter.of(4, null, "   "));

    assertThat(result.isFailed()).isTrue();
    assertThat(result.failures().get(0).reason()).isEqualTo("chapter has no text");
  }

  private ChapterProcessor processor(GenerationClient client) {
    return PipelineFixtures.processor(client, store, metrics, config);
  }

  private static ExtractionResult result(String principle) {
    return new ExtractionResult(
        Set.of("strategy"), List.of(TextNode.valueOf(principle)), null, null, null, null, null);
  }
}
