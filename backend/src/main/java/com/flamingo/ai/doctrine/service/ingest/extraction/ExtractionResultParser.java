package com.flamingo.ai.doctrine.service.ingest.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.doctrine.exception.StructuralValidationException;
import com.flamingo.ai.doctrine.service.ingest.model.ExtractionResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw model output into an {@link ExtractionResult}.
 *
 * <p>The output must be a JSON object, possibly wrapped in prose or code fences, with {@code
 * domains}, {@code principles}, {@code rules}, {@code claims} and {@code warnings} all present
 * and list-typed. Anything else raises {@link StructuralValidationException}.
 */
@Slf4j
public class ExtractionResultParser {

  static final List<String> REQUIRED_KEYS =
      List.of("domains", "principles", "rules", "claims", "warnings");

  private final ObjectMapper objectMapper;
  private final DomainInference domainInference;
  private final int maxDomains;

  public ExtractionResultParser(
      ObjectMapper objectMapper, DomainInference domainInference, int maxDomains) {
    this.objectMapper = objectMapper;
    this.domainInference = domainInference;
    this.maxDomains = maxDomains;
  }

  /**
   * Parses and validates model output.
   *
   * @param rawOutput text returned by the model
   * @param sourceText chunk text, used to infer domains when the model returned none
   */
  public ExtractionResult parse(String rawOutput, String sourceText) {
    JsonNode root = readObject(rawOutput);

    for (String key : REQUIRED_KEYS) {
      JsonNode value = root.get(key);
      if (value == null || value.isNull()) {
        throw new StructuralValidationException("Missing required key: " + key);
      }
      if (!value.isArray()) {
        throw new StructuralValidationException(
            "Key '" + key + "' must be a list but was " + value.getNodeType());
      }
    }

    Set<String> domains = normalizeDomains(root.get("domains"));
    if (domains.isEmpty()) {
      domains = new LinkedHashSet<>(domainInference.infer(sourceText));
      log.debug("Model returned no domains, inferred {}", domains);
    }

    Map<String, JsonNode> extra = new LinkedHashMap<>();
    root.fields()
        .forEachRemaining(
            field -> {
              if (!REQUIRED_KEYS.contains(field.getKey())) {
                extra.put(field.getKey(), field.getValue());
              }
            });

    return new ExtractionResult(
        domains,
        items(root.get("principles")),
        items(root.get("rules")),
        items(root.get("claims")),
        items(root.get("warnings")),
        null,
        extra);
  }

  private JsonNode readObject(String rawOutput) {
    if (rawOutput == null || rawOutput.isBlank()) {
      throw new StructuralValidationException("Empty model output");
    }
    String text = rawOutput.trim();
    JsonNode node = tryRead(text);
    if (node == null) {
      int start = text.indexOf('{');
      int end = text.lastIndexOf('}');
      if (start >= 0 && end > start) {
        node = tryRead(text.substring(start, end + 1));
      }
    }
    if (node == null) {
      throw new StructuralValidationException("Model output is not valid JSON");
    }
    if (!node.isObject()) {
      throw new StructuralValidationException(
          "Model output must be a JSON object but was " + node.getNodeType());
    }
    return node;
  }

  private JsonNode tryRead(String text) {
    try {
      return objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  // Domains may come back as strings or as {"name": ...} objects
  private Set<String> normalizeDomains(JsonNode domainsNode) {
    Set<String> domains = new LinkedHashSet<>();
    for (JsonNode entry : domainsNode) {
      String name;
      if (entry.isTextual()) {
        name = entry.asText();
      } else if (entry.isObject() && entry.hasNonNull("name")) {
        name = entry.get("name").asText();
      } else {
        continue;
      }
      name = name.trim().toLowerCase(Locale.ROOT);
      if (!name.isEmpty()) {
        domains.add(name);
      }
      if (domains.size() == maxDomains) {
        break;
      }
    }
    return domains;
  }

  private static List<JsonNode> items(JsonNode array) {
    List<JsonNode> items = new ArrayList<>();
    array.forEach(items::add);
    return items;
  }
}
