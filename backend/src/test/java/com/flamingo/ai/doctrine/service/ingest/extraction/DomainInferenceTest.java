package com.flamingo.ai.doctrine.service.ingest.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DomainInferenceTest {

  @Test
  void shouldRankDomainsByKeywordHits() {
    DomainInference inference = new DomainInference(DomainInference.DEFAULT_KEYWORDS, "base", 3);

    List<String> domains =
        inference.infer("Timing matters: tempo and speed decide the battle, not the plan.");

    assertThat(domains).containsExactly("timing", "conflict", "strategy");
  }

  @Test
  void shouldBreakTiesInConfigurationOrder() {
    Map<String, List<String>> keywords = new LinkedHashMap<>();
    keywords.put("beta", List.of("alpha"));
    keywords.put("alpha", List.of("alpha"));
    DomainInference inference = new DomainInference(keywords, "none", 1);

    assertThat(inference.infer("alpha")).containsExactly("beta");
  }

  @Test
  void shouldReturnFallback_whenNoKeywordMatches() {
    DomainInference inference = new DomainInference(DomainInference.DEFAULT_KEYWORDS, "base", 3);

    assertThat(inference.infer("zzz qqq")).containsExactly("base");
    assertThat(inference.infer(null)).containsExactly("base");
  }

  @Test
  void shouldExposeAllowedDomainsInOrder() {
    DomainInference inference = new DomainInference(DomainInference.DEFAULT_KEYWORDS, "base", 3);

    assertThat(List.copyOf(inference.allowedDomains()))
        .hasSize(18)
        .startsWith("adaptation", "base");
  }
}
