package com.flamingo.ai.doctrine.service.ingest.model;

import com.flamingo.ai.doctrine.service.ingest.MetricsSnapshot;
import java.util.List;

/**
 * Output of a pipeline run.
 *
 * @param chapters results in input order
 * @param metrics final metrics of the run
 */
public record PipelineResult(List<ChapterResult> chapters, MetricsSnapshot metrics) {

  public PipelineResult {
    chapters = List.copyOf(chapters);
  }

  public long failedChapters() {
    return chapters.stream().filter(ChapterResult::isFailed).count();
  }
}
