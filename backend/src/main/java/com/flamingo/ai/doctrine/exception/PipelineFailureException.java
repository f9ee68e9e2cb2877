package com.flamingo.ai.doctrine.exception;

import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import java.util.List;

/** Raised when every chapter of a run failed, which points at a systemic problem. */
public class PipelineFailureException extends RuntimeException {

  private final List<ChapterResult> results;

  public PipelineFailureException(String message, List<ChapterResult> results) {
    super(message);
    this.results = List.copyOf(results);
  }

  public List<ChapterResult> getResults() {
    return results;
  }
}
