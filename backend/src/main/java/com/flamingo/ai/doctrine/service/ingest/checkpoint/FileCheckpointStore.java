package com.flamingo.ai.doctrine.service.ingest.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores one JSON document per chapter under {@code <directory>/<key>.json}:
 *
 * <pre>{ "total_chunks": 3, "completed": { "0": {...}, "2": {...} } }</pre>
 *
 * <p>Every write replaces the whole file atomically. Unreadable files are treated as missing.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public FileCheckpointStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<CheckpointRecord> load(String key) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return read(key);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void markCompleted(String key, int totalChunks, int chunkIndex, ExtractionResult result) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      CheckpointRecord base =
          read(key)
              .filter(existing -> isCurrent(key, existing, totalChunks))
              .orElseGet(() -> CheckpointRecord.empty(totalChunks));
      CheckpointRecord updated = base.with(chunkIndex, result);
      write(key, updated);
    } finally {
      lock.unlock();
    }
  }

  public Path pathFor(String key) {
    return directory.resolve(key + ".json");
  }

  private Optional<CheckpointRecord> read(String key) {
    Path file = pathFor(key);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      CheckpointRecord record = objectMapper.readValue(file.toFile(), CheckpointRecord.class);
      if (record != null && !record.isWellFormed()) {
        log.warn("Ignoring malformed checkpoint {}: null or out-of-range chunk entries", file);
        return Optional.empty();
      }
      return Optional.ofNullable(record);
    } catch (IOException e) {
      log.warn("Ignoring unreadable checkpoint {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private boolean isCurrent(String key, CheckpointRecord existing, int totalChunks) {
    if (existing.totalChunks() != totalChunks) {
      log.warn(
          "Discarding stale checkpoint {}: recorded {} chunks, now {}",
          key,
          existing.totalChunks(),
          totalChunks);
      return false;
    }
    return true;
  }

  private void write(String key, CheckpointRecord checkpoint) {
    try {
      AtomicFileWriter.write(pathFor(key), objectMapper.writeValueAsBytes(checkpoint));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write checkpoint " + key, e);
    }
  }

  private ReentrantLock lockFor(String key) {
    return locks.computeIfAbsent(key, k -> new ReentrantLock());
  }
}
