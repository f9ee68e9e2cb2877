package com.flamingo.ai.doctrine.service.ingest.chunking;

import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.TextChunk;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits chapter text into chunks of at most {@code maxChars} characters, cutting at the last
 * paragraph break inside the window when there is one.
 *
 * <p>Boundaries depend only on the text and {@code maxChars}, so checkpointed chunk indexes stay
 * valid across runs. Blank slices are dropped before numbering.
 */
public class ChapterChunker {

  private static final String PARAGRAPH_BREAK = "\n\n";

  private final int maxChars;

  public ChapterChunker(int maxChars) {
    if (maxChars < 1) {
      throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
    }
    this.maxChars = maxChars;
  }

  public List<TextChunk> chunk(Chapter chapter) {
    List<String> slices = split(chapter.rawText());
    List<TextChunk> chunks = new ArrayList<>(slices.size());
    for (int i = 0; i < slices.size(); i++) {
      chunks.add(new TextChunk(chapter.chapterIndex(), i, slices.get(i)));
    }
    return chunks;
  }

  List<String> split(String text) {
    List<String> slices = new ArrayList<>();
    int length = text.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + maxChars, length);
      int cut = lastBreakBefore(text, start, end);
      if (cut <= start) {
        cut = end;
      }
      String slice = text.substring(start, cut);
      if (!slice.isBlank()) {
        slices.add(slice);
      }
      start = cut;
    }
    return slices;
  }

  // Index of the last paragraph break fully inside [start, end), or -1
  private static int lastBreakBefore(String text, int start, int end) {
    int idx = text.lastIndexOf(PARAGRAPH_BREAK, end - PARAGRAPH_BREAK.length());
    return idx >= start ? idx : -1;
  }
}
