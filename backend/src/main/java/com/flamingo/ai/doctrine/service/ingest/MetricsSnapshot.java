package com.flamingo.ai.doctrine.service.ingest;

/**
 * Metrics of a pipeline run at a point in time.
 *
 * @param elapsedSeconds seconds since the collector was created
 * @param processedChunks chunks extracted successfully
 * @param droppedChunks chunks that failed terminally
 * @param rateLimitHits rate-limit responses seen
 * @param errors failed generation attempts, including retried ones
 * @param verbatimWarnings results accepted with a verbatim warning
 * @param throughputChunksPerSec processed chunks per elapsed second
 * @param avgGenerationLatencyMs mean generation latency over the window
 * @param avgCheckpointLatencyMs mean checkpoint write latency over the window
 * @param avgChapterLatencyMs mean chapter processing time over the window
 */
public record MetricsSnapshot(
    double elapsedSeconds,
    long processedChunks,
    long droppedChunks,
    long rateLimitHits,
    long errors,
    long verbatimWarnings,
    double throughputChunksPerSec,
    double avgGenerationLatencyMs,
    double avgCheckpointLatencyMs,
    double avgChapterLatencyMs) {}
