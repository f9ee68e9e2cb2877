package com.flamingo.ai.doctrine.service.ingestion;

/** Lifecycle of an ingestion run. */
public enum IngestionStatus {

  /** Accepted and waiting for, or holding, an executor thread. */
  RUNNING,

  /** Every chapter has a result; some may be partial or failed. */
  COMPLETED,

  /** Every chapter failed, or the run crashed. */
  FAILED,

  /** Stopped on request before all chapters were handed out. */
  STOPPED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
