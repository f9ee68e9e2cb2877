package com.flamingo.ai.doctrine.service.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of processing one chapter. */
public enum ChapterStatus {

  /** Every chunk succeeded and at least one item was extracted. */
  OK,

  /** Every chunk succeeded but the chapter holds no actionable items. */
  VALID_EMPTY,

  /** Some chunks failed terminally, others succeeded. */
  PARTIAL,

  /** No chunk succeeded, the chapter was empty, or it was never processed. */
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
