package com.flamingo.ai.doctrine.service.ingest.extraction;

/** Prompt variant used for an extraction attempt. */
public enum PromptStrategy {

  /** First attempt: the standard extraction prompt. */
  BASE,

  /** Later attempts: standard prompt plus instructions to paraphrase harder and shorten. */
  PARAPHRASE;

  public static PromptStrategy forAttempt(int attemptNumber) {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("Attempt numbers start at 1: " + attemptNumber);
    }
    return attemptNumber == 1 ? BASE : PARAPHRASE;
  }
}
