package com.flamingo.ai.doctrine.service.ingest.checkpoint;

import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Checkpoint store that lives only as long as the process. */
public class InMemoryCheckpointStore implements CheckpointStore {

  private final ConcurrentMap<String, CheckpointRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<CheckpointRecord> load(String key) {
    return Optional.ofNullable(records.get(key));
  }

  @Override
  public void markCompleted(String key, int totalChunks, int chunkIndex, ExtractionResult result) {
    records.compute(
        key,
        (k, existing) -> {
          CheckpointRecord base =
              existing == null || existing.totalChunks() != totalChunks
                  ? CheckpointRecord.empty(totalChunks)
                  : existing;
          return base.with(chunkIndex, result);
        });
  }

  public void clear() {
    records.clear();
  }
}
