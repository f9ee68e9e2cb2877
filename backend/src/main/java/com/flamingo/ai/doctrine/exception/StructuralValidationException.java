package com.flamingo.ai.doctrine.exception;

/** Model output is not JSON, or lacks one of the required list-typed keys. */
public class StructuralValidationException extends RuntimeException {

  public StructuralValidationException(String message) {
    super(message);
  }

  public StructuralValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
