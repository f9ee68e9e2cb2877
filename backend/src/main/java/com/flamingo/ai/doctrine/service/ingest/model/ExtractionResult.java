package com.flamingo.ai.doctrine.service.ingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated output of one chunk extraction.
 *
 * <p>Items are kept as opaque JSON values. Keys the model returned beyond the required ones are
 * preserved in {@code extra}.
 *
 * @param domains 1 to 3 domain labels
 * @param principles principle items
 * @param rules rule items
 * @param claims claim items
 * @param warnings warning items
 * @param verbatimWarning set when an item copied a long run of source text
 * @param extra unrecognised top-level keys
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExtractionResult(
    Set<String> domains,
    List<JsonNode> principles,
    List<JsonNode> rules,
    List<JsonNode> claims,
    List<JsonNode> warnings,
    @JsonProperty("verbatim_warning") String verbatimWarning,
    Map<String, JsonNode> extra) {

  public ExtractionResult {
    domains = domains == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(domains));
    principles = principles == null ? List.of() : List.copyOf(principles);
    rules = rules == null ? List.of() : List.copyOf(rules);
    claims = claims == null ? List.of() : List.copyOf(claims);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public ExtractionResult withVerbatimWarning(String warning) {
    return new ExtractionResult(domains, principles, rules, claims, warnings, warning, extra);
  }

  /** True when at least one principle, rule, claim or warning was extracted. */
  public boolean hasActionableItems() {
    return !principles.isEmpty() || !rules.isEmpty() || !claims.isEmpty() || !warnings.isEmpty();
  }
}
