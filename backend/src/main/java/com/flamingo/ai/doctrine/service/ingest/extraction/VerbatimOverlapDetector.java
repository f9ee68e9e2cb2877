package com.flamingo.ai.doctrine.service.ingest.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Detects item texts that copy a long run of words from the source chunk. Comparison is on
 * lowercased text with whitespace collapsed.
 */
public class VerbatimOverlapDetector {

  private final int minWords;
  private final int maxWords;

  public VerbatimOverlapDetector(int minWords, int maxWords) {
    if (minWords < 1 || maxWords < minWords) {
      throw new IllegalArgumentException(
          "Invalid n-gram range: " + minWords + ".." + maxWords);
    }
    this.minWords = minWords;
    this.maxWords = maxWords;
  }

  /**
   * Finds the first copied phrase.
   *
   * @return the copied phrase, empty when no item overlaps the source
   */
  public Optional<String> findOverlap(ExtractionResult result, String sourceText) {
    String[] sourceWords = words(sourceText);
    if (sourceWords.length < minWords) {
      return Optional.empty();
    }
    Set<String> sourceGrams = ngrams(sourceWords);

    for (String text : itemTexts(result)) {
      String[] itemWords = words(text);
      int top = Math.min(maxWords, itemWords.length);
      for (int n = minWords; n <= top; n++) {
        for (int i = 0; i + n <= itemWords.length; i++) {
          String phrase = String.join(" ", Arrays.copyOfRange(itemWords, i, i + n));
          if (sourceGrams.contains(phrase)) {
            return Optional.of(phrase);
          }
        }
      }
    }
    return Optional.empty();
  }

  private Set<String> ngrams(String[] words) {
    Set<String> grams = new HashSet<>();
    int top = Math.min(maxWords, words.length);
    for (int n = minWords; n <= top; n++) {
      for (int i = 0; i + n <= words.length; i++) {
        grams.add(String.join(" ", Arrays.copyOfRange(words, i, i + n)));
      }
    }
    return grams;
  }

  static List<String> itemTexts(ExtractionResult result) {
    List<String> texts = new ArrayList<>();
    Stream.of(result.principles(), result.rules(), result.claims(), result.warnings())
        .flatMap(List::stream)
        .map(VerbatimOverlapDetector::itemText)
        .filter(text -> !text.isBlank())
        .forEach(texts::add);
    return texts;
  }

  // Known item shapes first, otherwise every textual leaf
  static String itemText(JsonNode item) {
    if (item.isTextual()) {
      return item.asText();
    }
    if (!item.isObject()) {
      return item.toString();
    }
    if (item.hasNonNull("statement")) {
      return item.get("statement").asText();
    }
    if (item.hasNonNull("condition") || item.hasNonNull("action")) {
      return (item.path("condition").asText("") + " " + item.path("action").asText("")).trim();
    }
    if (item.hasNonNull("claim")) {
      return item.get("claim").asText();
    }
    if (item.hasNonNull("situation") || item.hasNonNull("risk")) {
      return (item.path("situation").asText("") + " " + item.path("risk").asText("")).trim();
    }
    List<String> leaves = new ArrayList<>();
    collectText(item, leaves);
    return String.join(" ", leaves);
  }

  private static void collectText(JsonNode node, List<String> out) {
    if (node.isTextual()) {
      out.add(node.asText());
    } else if (node.isContainerNode()) {
      node.elements().forEachRemaining(child -> collectText(child, out));
    }
  }

  private static String[] words(String text) {
    if (text == null) {
      return new String[0];
    }
    String normalized = text.toLowerCase(Locale.ROOT).trim();
    return normalized.isEmpty() ? new String[0] : normalized.split("\\s+");
  }
}
