package com.flamingo.ai.doctrine.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.doctrine.service.ingest.MetricsSnapshot;
import com.flamingo.ai.doctrine.service.ingest.model.ChapterResult;
import com.flamingo.ai.doctrine.service.ingestion.IngestionRun;
import com.flamingo.ai.doctrine.service.ingestion.IngestionStatus;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionRunResponse {

  private String id;
  private String documentName;
  private IngestionStatus status;
  private Integer numWorkers;
  private Integer totalChapters;
  private Integer finishedChapters;
  private Long failedChapters;
  private String error;
  private Instant createdAt;
  private Instant completedAt;
  private MetricsSnapshot metrics;
  private List<ChapterResult> chapters;

  /** Summary view without chapter results. */
  public static IngestionRunResponse summaryOf(IngestionRun run) {
    return IngestionRunResponse.builder()
        .id(run.getId())
        .documentName(run.getDocumentName())
        .status(run.getStatus())
        .numWorkers(run.getNumWorkers())
        .totalChapters(run.getTotalChapters())
        .finishedChapters(run.getFinishedChapters())
        .failedChapters(run.getFailedChapters())
        .error(run.getError())
        .createdAt(run.getCreatedAt())
        .completedAt(run.getCompletedAt())
        .metrics(run.getMetrics())
        .build();
  }

  /** Full view including chapter results once the run has finished. */
  public static IngestionRunResponse fromRun(IngestionRun run) {
    IngestionRunResponse response = summaryOf(run);
    response.setChapters(run.getChapters());
    return response;
  }
}
