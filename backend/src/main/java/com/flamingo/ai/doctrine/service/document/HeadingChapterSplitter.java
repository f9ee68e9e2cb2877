package com.flamingo.ai.doctrine.service.document;

import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits text at book-style headings found at the start of a line: {@code THE FIRST BOOK}, {@code
 * BOOK IV}, {@code CHAPTER 12} and bare {@code THE <WORD>} headings.
 *
 * <p>With fewer than two headings the whole text becomes a single chapter. Text before the first
 * heading is treated as front matter and skipped. Chapter ids are the SHA-256 of the chapter text.
 */
@Component
@Slf4j
public class HeadingChapterSplitter implements ChapterSplitter {

  private static final List<Pattern> HEADINGS =
      List.of(
          Pattern.compile("(?m)^(THE\\s+[A-Z ]+BOOK)\\b"),
          Pattern.compile("(?m)^(BOOK\\s+[IVXLCDM]+)\\b"),
          Pattern.compile("(?m)^(CHAPTER\\s+\\d+)\\b"),
          Pattern.compile("(?m)^(THE\\s+[A-Z]+)\\b"));

  @Override
  public List<Chapter> split(Document document) {
    String text = document.fullText();
    if (text.isBlank()) {
      return List.of();
    }

    // Heading start offset -> heading text; the first pattern to match a position wins
    TreeMap<Integer, String> headings = new TreeMap<>();
    for (Pattern pattern : HEADINGS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        headings.putIfAbsent(matcher.start(), matcher.group(1).trim());
      }
    }

    if (headings.size() <= 1) {
      log.info("No chapter headings found in {}, using a single chapter", document.name());
      return List.of(Chapter.of(1, null, text));
    }

    List<Chapter> chapters = new ArrayList<>();
    List<Map.Entry<Integer, String>> entries = new ArrayList<>(headings.entrySet());
    for (int i = 0; i < entries.size(); i++) {
      int start = entries.get(i).getKey();
      int end = i + 1 < entries.size() ? entries.get(i + 1).getKey() : text.length();
      String body = text.substring(start, end).strip();
      if (!body.isEmpty()) {
        chapters.add(Chapter.of(chapters.size() + 1, entries.get(i).getValue(), body));
      }
    }
    log.info("Split {} into {} chapters", document.name(), chapters.size());
    return chapters;
  }
}
