package com.flamingo.ai.doctrine.service.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Aggregated extraction output for one chapter.
 *
 * @param chapterIndex position in the input
 * @param chapterId chapter identifier
 * @param title optional chapter title
 * @param domains sorted union of the chunk domains
 * @param principles deduplicated principles in chunk order
 * @param rules deduplicated rules in chunk order
 * @param claims deduplicated claims in chunk order
 * @param warnings deduplicated warnings in chunk order
 * @param status chapter outcome
 * @param totalChunks number of chunks the chapter was split into
 * @param completedChunks chunks with a result, fresh or from checkpoint
 * @param failures chunks that failed terminally
 * @param verbatimWarnings number of chunk results accepted with a verbatim warning
 */
public record ChapterResult(
    int chapterIndex,
    String chapterId,
    String title,
    List<String> domains,
    List<JsonNode> principles,
    List<JsonNode> rules,
    List<JsonNode> claims,
    List<JsonNode> warnings,
    ChapterStatus status,
    int totalChunks,
    int completedChunks,
    List<ChunkFailure> failures,
    int verbatimWarnings) {

  public ChapterResult {
    domains = domains == null ? List.of() : List.copyOf(domains);
    principles = principles == null ? List.of() : List.copyOf(principles);
    rules = rules == null ? List.of() : List.copyOf(rules);
    claims = claims == null ? List.of() : List.copyOf(claims);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /** An empty failed result, used for chapters that produced no result at all. */
  public static ChapterResult failed(Chapter chapter, String reason) {
    return new ChapterResult(
        chapter.chapterIndex(),
        chapter.chapterId(),
        chapter.title(),
        List.of(),
        List.of(),
        List.of(),
        List.of(),
        List.of(),
        ChapterStatus.FAILED,
        0,
        0,
        List.of(new ChunkFailure(-1, reason)),
        0);
  }

  @JsonIgnore
  public boolean isFailed() {
    return status == ChapterStatus.FAILED;
  }
}
