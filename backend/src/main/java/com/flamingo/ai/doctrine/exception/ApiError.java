package com.flamingo.ai.doctrine.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String RUN_NOT_FOUND = "RUN_001";
  public static final String RUN_QUEUE_FULL = "RUN_003";
  public static final String DOCUMENT_PARSE_ERROR = "DOCUMENT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id that also appears in the server log. */
  private final String errorId;

  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
