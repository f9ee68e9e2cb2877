package com.flamingo.ai.doctrine.service.ingest.extraction;

/**
 * One step of the chunk retry state machine.
 *
 * @param number 1-based attempt number
 * @param strategy prompt variant for this attempt
 */
public record ExtractionAttempt(int number, PromptStrategy strategy) {

  public static ExtractionAttempt first() {
    return of(1);
  }

  public static ExtractionAttempt of(int number) {
    return new ExtractionAttempt(number, PromptStrategy.forAttempt(number));
  }

  public ExtractionAttempt next() {
    return of(number + 1);
  }

  public boolean hasNext(int maxAttempts) {
    return number < maxAttempts;
  }
}
