package com.flamingo.ai.doctrine.api.rest;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.service.ingestion.IngestionRun;
import com.flamingo.ai.doctrine.service.ingestion.IngestionService;
import com.flamingo.ai.doctrine.service.ingestion.IngestionStatus;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and run statistics. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final IngestionService ingestionService;
  private final IngestConfig ingestConfig;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "doctrine-ingest");
    return ResponseEntity.ok(health);
  }

  /** Returns run counts by status and the active pipeline settings. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<IngestionStatus, Long> byStatus = new EnumMap<>(IngestionStatus.class);
    for (IngestionRun run : ingestionService.listRuns()) {
      byStatus.merge(run.getStatus(), 1L, Long::sum);
    }
    Map<String, Object> stats = new HashMap<>();
    stats.put("runs", byStatus);
    stats.put("checkpointStore", ingestConfig.getCheckpoint().getStore());
    stats.put("defaultWorkers", ingestConfig.getPipeline().getNumWorkers());
    stats.put("model", ingestConfig.getExtraction().getModel());
    stats.put("timestamp", Instant.now());
    return ResponseEntity.ok(stats);
  }
}
