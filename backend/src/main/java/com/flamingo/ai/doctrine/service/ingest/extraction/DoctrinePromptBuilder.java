package com.flamingo.ai.doctrine.service.ingest.extraction;

import com.flamingo.ai.doctrine.service.ingest.model.TextChunk;
import java.util.Collection;

/** Builds the system and user prompts for a chunk extraction. */
public class DoctrinePromptBuilder {

  private static final String JSON_SKELETON =
      """
      {
          "domains": [],
          "principles": [],
          "rules": [],
          "claims": [],
          "warnings": []
      }""";

  private static final String RETRY_SUFFIX =
      """

      RETRY MODE:
      - Paraphrase aggressively
      - Reduce sentence length
      - Prefer generalized verbs
      - If possible, satisfy the minimum extraction counts listed above
      """;

  private final String systemPrompt;
  private final int maxChunkChars;

  public DoctrinePromptBuilder(Collection<String> allowedDomains, int maxChunkChars) {
    this.systemPrompt = buildSystemPrompt(String.join(", ", allowedDomains));
    this.maxChunkChars = maxChunkChars;
  }

  public String systemPrompt() {
    return systemPrompt;
  }

  public String userPrompt(TextChunk chunk, PromptStrategy strategy) {
    String text = chunk.text();
    if (text.length() > maxChunkChars) {
      text = text.substring(0, maxChunkChars);
    }
    String prompt =
        "RETURN JSON WITH THIS EXACT STRUCTURE:\n\n"
            + JSON_SKELETON
            + "\n\nCHAPTER INDEX: "
            + chunk.chapterIndex()
            + "\n\nTEXT (for analysis only, DO NOT QUOTE):\n"
            + "--------------------------------------\n"
            + text
            + "\n--------------------------------------\n\n"
            + "INSTRUCTIONS:\n"
            + "1. Select 1-3 applicable DOMAINS from the provided list.\n"
            + "2. Extract actionable operational content: principles, rules, decision criteria,"
            + " warnings, or claims.\n"
            + "3. Generalize: convert specific examples into abstract, normalized language.\n"
            + "4. Do not quote; paraphrase and abstract.\n\n"
            + "EXTRACTION REQUIREMENTS:\n"
            + "- If the text contains operational guidance, extract it.\n"
            + "- If a field seems empty, infer from context (e.g. infer rules from principles).\n"
            + "- Over-extraction is better than under-extraction.\n"
            + "- If guidance exists, aim for at least 1-2 items per field.\n"
            + "- DOMAINS MUST NOT BE EMPTY.\n\n"
            + "If the text has no operational content, return minimal valid JSON with domains"
            + " populated.\n";
    return strategy == PromptStrategy.PARAPHRASE ? prompt + RETRY_SUFFIX : prompt;
  }

  private static String buildSystemPrompt(String allowedDomains) {
    return """
        You are an operational doctrine extraction engine.

        Your task is to EXTRACT actionable operational guidance from text.
        Not to quote verbatim, but to ABSTRACT principles, rules, decision criteria, warnings,
        and claims.

        MANDATORY OUTPUT REQUIREMENTS:
        - You MUST include a field called "domains".
        - "domains" MUST be a list of 1 to 3 items.
        - Each domain MUST be chosen ONLY from the list below.
        - If no domain applies, choose the closest applicable domain.

        ALLOWED DOMAINS (EXACT STRINGS):
        %s

        EXTRACTION GUIDELINES:
        1. A PRINCIPLE is a fundamental truth or foundation for action.
        2. A RULE is a prescriptive action, constraint, or decision criterion.
        3. A CLAIM is a factual assertion made by the text.
        4. A WARNING is a cautionary statement or risk indicator.

        EXTRACTION RULES:
        - Generalize language: convert specific examples into abstract principles.
        - DO NOT quote sentences verbatim; paraphrase into normalized language.
        - DO NOT quote phrases longer than 10 consecutive words from the original.
        - Ignore plot summaries, character development and meta-commentary.

        Return ONLY valid JSON matching the schema. Do not include commentary.
        """
        .formatted(allowedDomains);
  }
}
