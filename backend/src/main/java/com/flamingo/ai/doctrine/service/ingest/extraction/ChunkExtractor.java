package com.flamingo.ai.doctrine.service.ingest.extraction;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.exception.ChunkExtractionException;
import com.flamingo.ai.doctrine.exception.LlmServiceException;
import com.flamingo.ai.doctrine.exception.StructuralValidationException;
import com.flamingo.ai.doctrine.service.ingest.IngestMetrics;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import com.flamingo.ai.doctrine.service.ingest.model.TextChunk;
import com.flamingo.ai.doctrine.service.ingest.ratecontrol.AdaptiveRateController;
import com.flamingo.ai.doctrine.service.ingest.ratecontrol.AdaptiveRateController.Permit;
import com.flamingo.ai.doctrine.service.llm.GenerationClient;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts one chunk: holds a rate-controller permit for the generate, parse and validate steps,
 * retries with a paraphrase prompt, and checkpoints the accepted result.
 *
 * <p>Verbatim overlap does not trigger a retry. The result is accepted with {@code
 * verbatimWarning} set and counted.
 */
@Slf4j
public class ChunkExtractor {

  static final Duration MAX_BACKOFF = Duration.ofSeconds(32);

  private final GenerationClient generationClient;
  private final AdaptiveRateController rateController;
  private final CheckpointStore checkpointStore;
  private final DoctrinePromptBuilder promptBuilder;
  private final ExtractionResultParser resultParser;
  private final VerbatimOverlapDetector verbatimDetector;
  private final IngestMetrics metrics;
  private final IngestConfig.Extraction config;
  private final Duration acquireTimeout;

  public ChunkExtractor(
      GenerationClient generationClient,
      AdaptiveRateController rateController,
      CheckpointStore checkpointStore,
      DoctrinePromptBuilder promptBuilder,
      ExtractionResultParser resultParser,
      VerbatimOverlapDetector verbatimDetector,
      IngestMetrics metrics,
      IngestConfig.Extraction config,
      Duration acquireTimeout) {
    this.generationClient = generationClient;
    this.rateController = rateController;
    this.checkpointStore = checkpointStore;
    this.promptBuilder = promptBuilder;
    this.resultParser = resultParser;
    this.verbatimDetector = verbatimDetector;
    this.metrics = metrics;
    this.config = config;
    this.acquireTimeout = acquireTimeout;
  }

  /**
   * Extracts a chunk and checkpoints the result under the chapter's key.
   *
   * @param chapter owning chapter
   * @param chunk chunk to extract
   * @param totalChunks number of chunks in the chapter
   * @return the accepted result
   * @throws ChunkExtractionException when every attempt failed
   */
  public ExtractionResult extract(Chapter chapter, TextChunk chunk, int totalChunks) {
    int maxAttempts = Math.max(1, config.getMaxAttempts());
    ExtractionAttempt attempt = ExtractionAttempt.first();
    String reason;
    RuntimeException lastError;

    while (true) {
      boolean rateLimited = false;
      try {
        ExtractionResult result = runAttempt(chunk, attempt);
        checkpoint(chapter, chunk, totalChunks, result);
        metrics.recordProcessed();
        return result;
      } catch (StructuralValidationException e) {
        reason = "invalid model output: " + e.getMessage();
        lastError = e;
      } catch (LlmServiceException e) {
        rateLimited = e.isRateLimited();
        reason = (rateLimited ? "rate limited: " : "generation failed: ") + e.getMessage();
        lastError = e;
        if (rateLimited) {
          metrics.recordRateLimit();
        }
      } catch (AdaptiveRateController.PermitTimeoutException e) {
        reason = e.getMessage();
        lastError = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        metrics.recordDropped();
        throw new ChunkExtractionException(
            chunk.chapterIndex(), chunk.chunkIndex(), "interrupted", e);
      }

      metrics.recordError();
      if (!attempt.hasNext(maxAttempts)) {
        break;
      }
      log.warn(
          "Chapter {} chunk {} attempt {} failed, retrying: {}",
          chunk.chapterIndex(),
          chunk.chunkIndex(),
          attempt.number(),
          reason);
      if (rateLimited && !backOff(attempt)) {
        break;
      }
      attempt = attempt.next();
    }

    metrics.recordDropped();
    log.error(
        "Chapter {} chunk {} failed after {} attempts: {}",
        chunk.chapterIndex(),
        chunk.chunkIndex(),
        attempt.number(),
        reason);
    throw new ChunkExtractionException(chunk.chapterIndex(), chunk.chunkIndex(), reason, lastError);
  }

  private ExtractionResult runAttempt(TextChunk chunk, ExtractionAttempt attempt)
      throws InterruptedException {
    String userPrompt = promptBuilder.userPrompt(chunk, attempt.strategy());
    log.debug(
        "Chapter {} chunk {} attempt {} ({})",
        chunk.chapterIndex(),
        chunk.chunkIndex(),
        attempt.number(),
        attempt.strategy());

    try (Permit permit = rateController.acquire(acquireTimeout)) {
      long start = System.nanoTime();
      String output;
      try {
        output =
            generationClient.generate(
                promptBuilder.systemPrompt(), userPrompt, config.getModel(), config.getTimeout());
      } catch (LlmServiceException e) {
        if (e.isRateLimited()) {
          rateController.recordRateLimit();
        } else {
          rateController.recordFailure();
        }
        throw e;
      } catch (RuntimeException e) {
        rateController.recordFailure();
        throw new LlmServiceException("Generation failed: " + e.getMessage(), e);
      }
      Duration latency = Duration.ofNanos(System.nanoTime() - start);
      rateController.recordSuccess(latency);
      metrics.recordGenerationLatency(latency);

      ExtractionResult result = resultParser.parse(output, chunk.text());
      Optional<String> overlap = verbatimDetector.findOverlap(result, chunk.text());
      if (overlap.isPresent()) {
        String phrase = overlap.get();
        String preview = phrase.length() > 80 ? phrase.substring(0, 80) + "..." : phrase;
        log.warn(
            "Chapter {} chunk {} accepted with verbatim phrase: '{}'",
            chunk.chapterIndex(),
            chunk.chunkIndex(),
            preview);
        metrics.recordVerbatimWarning();
        result = result.withVerbatimWarning("Verbatim phrase detected: '" + preview + "'");
      }
      return result;
    }
  }

  private void checkpoint(Chapter chapter, TextChunk chunk, int totalChunks, ExtractionResult r) {
    long start = System.nanoTime();
    try {
      checkpointStore.markCompleted(chapter.checkpointKey(), totalChunks, chunk.chunkIndex(), r);
    } catch (UncheckedIOException e) {
      log.error(
          "Chapter {} chunk {} extracted but checkpoint write failed: {}",
          chunk.chapterIndex(),
          chunk.chunkIndex(),
          e.getMessage());
      metrics.recordError();
    } finally {
      metrics.recordCheckpointLatency(Duration.ofNanos(System.nanoTime() - start));
    }
  }

  /** Sleeps before the next attempt. Returns false if interrupted. */
  private boolean backOff(ExtractionAttempt attempt) {
    Duration delay = backoffFor(config.getRateLimitBackoff(), attempt.number());
    log.info(
        "Rate limited, backing off {}ms before attempt {}", delay.toMillis(), attempt.number() + 1);
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  static Duration backoffFor(Duration base, int attemptNumber) {
    long factor = 1L << Math.min(attemptNumber - 1, 20);
    Duration delay = base.multipliedBy(factor);
    return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
  }
}
