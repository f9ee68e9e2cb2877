package com.flamingo.ai.doctrine.exception;

import lombok.Getter;

/** Exception thrown when an ingestion run is not found. */
@Getter
public class IngestionRunNotFoundException extends RuntimeException {

  private final String runId;

  public IngestionRunNotFoundException(String runId) {
    super("Ingestion run not found: " + runId);
    this.runId = runId;
  }
}
