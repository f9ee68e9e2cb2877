package com.flamingo.ai.doctrine.service.ingest.model;

/**
 * A chunk that exhausted its extraction attempts.
 *
 * @param chunkIndex failed chunk
 * @param reason last error seen
 */
public record ChunkFailure(int chunkIndex, String reason) {}
