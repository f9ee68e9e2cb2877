package com.flamingo.ai.doctrine.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterStatus;
import com.flamingo.ai.doctrine.service.ingest.model.ChunkFailure;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Merges per-chunk results into a chapter result. */
public class ChapterAggregator {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Builds the chapter result.
   *
   * <p>Domains are unioned and sorted. Item lists are concatenated in chunk order, then
   * deduplicated keeping the first occurrence. Two items are duplicates when they are equal after
   * trimming, collapsing whitespace and lowercasing every string, at any depth, with object keys
   * compared order-insensitively.
   */
  public ChapterResult aggregate(
      Chapter chapter,
      int totalChunks,
      SortedMap<Integer, ExtractionResult> completed,
      List<ChunkFailure> failures) {
    Set<String> domains = new TreeSet<>();
    List<JsonNode> principles = new ArrayList<>();
    List<JsonNode> rules = new ArrayList<>();
    List<JsonNode> claims = new ArrayList<>();
    List<JsonNode> warnings = new ArrayList<>();
    int verbatimWarnings = 0;

    for (ExtractionResult result : completed.values()) {
      domains.addAll(result.domains());
      principles.addAll(result.principles());
      rules.addAll(result.rules());
      claims.addAll(result.claims());
      warnings.addAll(result.warnings());
      if (result.verbatimWarning() != null) {
        verbatimWarnings++;
      }
    }

    List<JsonNode> uniquePrinciples = dedupe(principles);
    List<JsonNode> uniqueRules = dedupe(rules);
    List<JsonNode> uniqueClaims = dedupe(claims);
    List<JsonNode> uniqueWarnings = dedupe(warnings);

    ChapterStatus status;
    if (completed.isEmpty()) {
      status = ChapterStatus.FAILED;
    } else if (!failures.isEmpty()) {
      status = ChapterStatus.PARTIAL;
    } else if (uniquePrinciples.isEmpty()
        && uniqueRules.isEmpty()
        && uniqueClaims.isEmpty()
        && uniqueWarnings.isEmpty()) {
      status = ChapterStatus.VALID_EMPTY;
    } else {
      status = ChapterStatus.OK;
    }

    return new ChapterResult(
        chapter.chapterIndex(),
        chapter.chapterId(),
        chapter.title(),
        List.copyOf(domains),
        uniquePrinciples,
        uniqueRules,
        uniqueClaims,
        uniqueWarnings,
        status,
        totalChunks,
        completed.size(),
        failures,
        verbatimWarnings);
  }

  static List<JsonNode> dedupe(List<JsonNode> items) {
    Set<String> seen = new HashSet<>();
    List<JsonNode> unique = new ArrayList<>();
    for (JsonNode item : items) {
      if (seen.add(normalize(item).toString())) {
        unique.add(item);
      }
    }
    return unique;
  }

  static JsonNode normalize(JsonNode node) {
    if (node == null || node.isNull()) {
      return JsonNodeFactory.instance.nullNode();
    }
    if (node.isTextual()) {
      return TextNode.valueOf(normalizeText(node.asText()));
    }
    if (node.isArray()) {
      ArrayNode array = JsonNodeFactory.instance.arrayNode();
      node.forEach(child -> array.add(normalize(child)));
      return array;
    }
    if (node.isObject()) {
      TreeMap<String, JsonNode> sorted = new TreeMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        sorted.put(field.getKey(), normalize(field.getValue()));
      }
      ObjectNode object = JsonNodeFactory.instance.objectNode();
      sorted.forEach(object::set);
      return object;
    }
    return node;
  }

  static String normalizeText(String text) {
    return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
