package com.flamingo.ai.doctrine.service.ingest.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Persisted progress of one chapter.
 *
 * @param totalChunks number of chunks the chapter was split into when the record was written
 * @param completed finished chunk results keyed by chunk index
 */
public record CheckpointRecord(
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("completed") SortedMap<Integer, ExtractionResult> completed) {

  public CheckpointRecord {
    completed =
        completed == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(completed));
  }

  public static CheckpointRecord empty(int totalChunks) {
    return new CheckpointRecord(totalChunks, null);
  }

  /** Returns a copy with {@code result} stored under {@code chunkIndex}. */
  public CheckpointRecord with(int chunkIndex, ExtractionResult result) {
    TreeMap<Integer, ExtractionResult> merged = new TreeMap<>(completed);
    merged.put(chunkIndex, result);
    return new CheckpointRecord(totalChunks, merged);
  }

  /** True when every stored index lies in {@code [0, totalChunks)} and holds a result. */
  @JsonIgnore
  public boolean isWellFormed() {
    if (totalChunks < 0) {
      return false;
    }
    return completed.entrySet().stream()
        .allMatch(
            entry ->
                entry.getKey() != null
                    && entry.getKey() >= 0
                    && entry.getKey() < totalChunks
                    && entry.getValue() != null);
  }

  @JsonIgnore
  public boolean isComplete() {
    return completed.size() == totalChunks;
  }
}
