package com.flamingo.ai.doctrine.service.ingest;

import com.flamingo.ai.doctrine.exception.ChunkExtractionException;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointRecord;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.chunking.ChapterChunker;
import com.flamingo.ai.doctrine.service.ingest.extraction.ChunkExtractor;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.ChunkFailure;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import com.flamingo.ai.doctrine.service.ingest.model.TextChunk;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Processes one chapter: restores checkpointed chunks, extracts the rest in order and aggregates.
 *
 * <p>A chapter whose checkpoint is complete is rebuilt without any generation call. A failing
 * chunk is recorded and skipped; it never aborts the chapter.
 */
@Slf4j
public class ChapterProcessor {

  private final ChapterChunker chunker;
  private final ChunkExtractor extractor;
  private final CheckpointStore checkpointStore;
  private final ChapterAggregator aggregator;
  private final IngestMetrics metrics;

  public ChapterProcessor(
      ChapterChunker chunker,
      ChunkExtractor extractor,
      CheckpointStore checkpointStore,
      ChapterAggregator aggregator,
      IngestMetrics metrics) {
    this.chunker = chunker;
    this.extractor = extractor;
    this.checkpointStore = checkpointStore;
    this.aggregator = aggregator;
    this.metrics = metrics;
  }

  public ChapterResult process(Chapter chapter) {
    return process(chapter, IngestProgressListener.NOOP);
  }

  public ChapterResult process(Chapter chapter, IngestProgressListener listener) {
    long start = System.nanoTime();
    List<TextChunk> chunks = chunker.chunk(chapter);
    int total = chunks.size();
    listener.chapterStarted(chapter, total);

    if (chunks.isEmpty()) {
      log.error("Chapter {} has no text to extract", chapter.chapterIndex());
      return finish(chapter, ChapterResult.failed(chapter, "chapter has no text"), start, listener);
    }

    SortedMap<Integer, ExtractionResult> completed = restore(chapter, total);
    if (completed.size() == total) {
      log.info(
          "Chapter {} restored from checkpoint ({} chunks)", chapter.chapterIndex(), total);
    } else {
      log.info(
          "Chapter {} started: {} chunks, {} from checkpoint",
          chapter.chapterIndex(),
          total,
          completed.size());
    }

    List<ChunkFailure> failures = new ArrayList<>();
    for (TextChunk chunk : chunks) {
      if (completed.containsKey(chunk.chunkIndex())) {
        continue;
      }
      if (Thread.currentThread().isInterrupted()) {
        failures.add(new ChunkFailure(chunk.chunkIndex(), "interrupted"));
        continue;
      }
      try {
        completed.put(chunk.chunkIndex(), extractor.extract(chapter, chunk, total));
        listener.chunkCompleted(chapter, chunk.chunkIndex(), completed.size(), total);
      } catch (ChunkExtractionException e) {
        failures.add(new ChunkFailure(chunk.chunkIndex(), e.getReason()));
      }
    }

    ChapterResult result = aggregator.aggregate(chapter, total, completed, failures);
    if (result.isFailed()) {
      log.error(
          "Chapter {} failed: all {} chunks failed", chapter.chapterIndex(), failures.size());
    } else {
      log.info(
          "Chapter {} finished: status={}, {}/{} chunks, {} failed",
          chapter.chapterIndex(),
          result.status().value(),
          result.completedChunks(),
          total,
          failures.size());
    }
    return finish(chapter, result, start, listener);
  }

  private SortedMap<Integer, ExtractionResult> restore(Chapter chapter, int total) {
    Optional<CheckpointRecord> checkpoint = checkpointStore.load(chapter.checkpointKey());
    SortedMap<Integer, ExtractionResult> completed = new TreeMap<>();
    if (checkpoint.isEmpty()) {
      return completed;
    }
    CheckpointRecord saved = checkpoint.get();
    if (saved.totalChunks() != total) {
      log.warn(
          "Ignoring stale checkpoint for chapter {}: recorded {} chunks, now {}",
          chapter.chapterIndex(),
          saved.totalChunks(),
          total);
      return completed;
    }
    saved.completed().forEach(
        (index, result) -> {
          if (index >= 0 && index < total) {
            completed.put(index, result);
          }
        });
    return completed;
  }

  private ChapterResult finish(
      Chapter chapter, ChapterResult result, long startNanos, IngestProgressListener listener) {
    metrics.recordChapterLatency(Duration.ofNanos(System.nanoTime() - startNanos));
    listener.chapterFinished(result);
    log.debug("Chapter {} ({}) done", chapter.chapterIndex(), chapter.chapterId());
    return result;
  }
}
