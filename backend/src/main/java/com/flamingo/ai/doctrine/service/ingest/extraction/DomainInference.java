package com.flamingo.ai.doctrine.service.ingest.extraction;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Guesses domains from keyword counts when the model returned none. */
public class DomainInference {

  /** Allowed domains and the keywords that suggest them. */
  public static final Map<String, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

  private final Map<String, List<String>> keywords;
  private final String fallbackDomain;
  private final int maxDomains;

  public DomainInference(
      Map<String, List<String>> keywords, String fallbackDomain, int maxDomains) {
    this.keywords = new LinkedHashMap<>(keywords);
    this.fallbackDomain = fallbackDomain;
    this.maxDomains = maxDomains;
  }

  /** The allowed domain vocabulary, in configuration order. */
  public Set<String> allowedDomains() {
    return keywords.keySet();
  }

  /**
   * Returns up to {@code maxDomains} domains ranked by keyword hits, ties in configuration order,
   * or the fallback domain when nothing matches.
   */
  public List<String> infer(String text) {
    String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
    Map<String, Integer> scores = new LinkedHashMap<>();
    keywords.forEach(
        (domain, words) -> {
          int score = 0;
          for (String word : words) {
            score += countOccurrences(lower, word.toLowerCase(Locale.ROOT));
          }
          if (score > 0) {
            scores.put(domain, score);
          }
        });
    if (scores.isEmpty()) {
      return List.of(fallbackDomain);
    }
    return scores.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(maxDomains)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  private static int countOccurrences(String haystack, String needle) {
    if (needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int from = haystack.indexOf(needle);
    while (from >= 0) {
      count++;
      from = haystack.indexOf(needle, from + needle.length());
    }
    return count;
  }

  private static Map<String, List<String>> defaultKeywords() {
    Map<String, List<String>> keywords = new LinkedHashMap<>();
    keywords.put("adaptation", List.of("adapt", "adaptation", "adaptable"));
    keywords.put("base", List.of("base", "ground", "position"));
    keywords.put("conflict", List.of("conflict", "fight", "battle", "combat"));
    keywords.put("constraints", List.of("limit", "constraint"));
    keywords.put("data", List.of("intelligence", "data", "information", "intel"));
    keywords.put("diplomacy", List.of("diplomacy", "negotiat", "treaty"));
    keywords.put("discipline", List.of("discipline", "order", "training"));
    keywords.put("executor", List.of("execute", "executor", "implement"));
    keywords.put("legitimacy", List.of("legitimacy", "legitimize", "authority"));
    keywords.put("optionality", List.of("option", "optional", "choices"));
    keywords.put("power", List.of("power", "force", "strength", "army"));
    keywords.put("psychology", List.of("moral", "morale", "psych", "fear", "confidence"));
    keywords.put("registry", List.of("register", "record", "registry"));
    keywords.put("risk", List.of("risk", "danger", "hazard", "loss"));
    keywords.put("strategy", List.of("strategy", "strategic", "plan", "planning"));
    keywords.put("technology", List.of("technology", "tech", "weapon", "armament"));
    keywords.put("timing", List.of("time", "timing", "tempo", "speed"));
    keywords.put("truth", List.of("truth", "fact", "verify"));
    return Collections.unmodifiableMap(keywords);
  }
}
