package com.flamingo.ai.doctrine.service.ingest.checkpoint;

import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.Optional;

/**
 * Key-value store for per-chapter extraction progress. Implementations must be safe for concurrent
 * use; each key is written by one chapter worker at a time.
 */
public interface CheckpointStore {

  /**
   * Loads the record for a key.
   *
   * @param key checkpoint key, see {@code Chapter#checkpointKey()}
   * @return the record, or empty when none exists or it could not be read
   */
  Optional<CheckpointRecord> load(String key);

  /**
   * Records a finished chunk and persists the merged record before returning.
   *
   * <p>A stored record whose total chunk count differs from {@code totalChunks} is discarded.
   */
  void markCompleted(String key, int totalChunks, int chunkIndex, ExtractionResult result);

  /** True when every chunk of the key has a stored result. */
  default boolean isCompleted(String key) {
    return load(key).map(CheckpointRecord::isComplete).orElse(false);
  }
}
