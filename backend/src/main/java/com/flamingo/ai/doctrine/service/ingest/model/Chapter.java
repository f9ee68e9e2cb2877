package com.flamingo.ai.doctrine.service.ingest.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One chapter of a document, the unit of work handed to a chapter worker.
 *
 * @param chapterIndex position of the chapter in the document (1-based when produced by the
 *     splitter)
 * @param chapterId stable identifier; the SHA-256 of the raw text when none was supplied
 * @param title optional heading text
 * @param rawText full chapter text
 */
public record Chapter(int chapterIndex, String chapterId, String title, String rawText) {

  public Chapter {
    rawText = rawText == null ? "" : rawText;
    if (chapterId == null || chapterId.isBlank()) {
      chapterId = sha256(rawText);
    }
  }

  public static Chapter of(int chapterIndex, String title, String rawText) {
    return new Chapter(chapterIndex, null, title, rawText);
  }

  /** Key under which this chapter's per-chunk progress is checkpointed. */
  public String checkpointKey() {
    return "chapter_" + chapterId;
  }

  public static String sha256(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
