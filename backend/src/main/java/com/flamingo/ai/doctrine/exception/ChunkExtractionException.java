package com.flamingo.ai.doctrine.exception;

import lombok.Getter;

/** Thrown when a chunk has failed every extraction attempt. */
@Getter
public class ChunkExtractionException extends RuntimeException {

  private final int chapterIndex;
  private final int chunkIndex;
  private final String reason;

  public ChunkExtractionException(
      int chapterIndex, int chunkIndex, String reason, Throwable cause) {
    super(
        String.format(
            "Extraction failed for chapter %d chunk %d: %s", chapterIndex, chunkIndex, reason),
        cause);
    this.chapterIndex = chapterIndex;
    this.chunkIndex = chunkIndex;
    this.reason = reason;
  }
}
