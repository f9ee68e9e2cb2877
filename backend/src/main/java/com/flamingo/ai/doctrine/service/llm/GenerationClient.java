package com.flamingo.ai.doctrine.service.llm;

import java.time.Duration;

/**
 * Text generation capability used by the extraction pipeline.
 *
 * <p>Implementations do not retry; retry and back-off belong to the caller. Failures are reported
 * as {@link com.flamingo.ai.doctrine.exception.LlmServiceException}, flagged as rate limited for
 * HTTP 429 style errors.
 */
@FunctionalInterface
public interface GenerationClient {

  /**
   * Generates a completion for a prompt.
   *
   * @param prompt full prompt text
   * @param model model name
   * @param timeout upper bound for the call
   * @return raw model output
   */
  String generate(String prompt, String model, Duration timeout);

  /** Generates with a separate system prompt. By default the system prompt is prepended. */
  default String generate(String systemPrompt, String prompt, String model, Duration timeout) {
    return generate(systemPrompt + "\n\n" + prompt, model, timeout);
  }
}
