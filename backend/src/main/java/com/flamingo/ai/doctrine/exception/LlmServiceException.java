package com.flamingo.ai.doctrine.exception;

/** Thrown when a generation call fails. Never retried by the client itself. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    this(message, false, null);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, false, cause);
  }

  public LlmServiceException(String message, boolean rateLimited) {
    this(message, rateLimited, null);
  }

  public LlmServiceException(String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  /** True for HTTP 429 and provider rate-limit errors. */
  public boolean isRateLimited() {
    return rateLimited;
  }
}
