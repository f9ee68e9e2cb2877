package com.flamingo.ai.doctrine.api.rest;

import com.flamingo.ai.doctrine.api.dto.request.StartIngestionRequest;
import com.flamingo.ai.doctrine.api.dto.response.IngestionRunResponse;
import com.flamingo.ai.doctrine.service.ingestion.IngestionRun;
import com.flamingo.ai.doctrine.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for ingestion runs. */
@RestController
@RequestMapping("/api/ingestions")
@RequiredArgsConstructor
public class IngestionController {

  private final IngestionService ingestionService;

  /** Starts a run from raw text or a list of page texts. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestionRunResponse> startIngestion(
      @Valid @RequestBody StartIngestionRequest request) {
    IngestionRun run;
    if (request.getPages() != null && !request.getPages().isEmpty()) {
      run =
          ingestionService.startPages(
              request.getName(), request.getPages(), request.getNumWorkers());
    } else if (request.getText() != null && !request.getText().isBlank()) {
      run =
          ingestionService.startText(request.getName(), request.getText(), request.getNumWorkers());
    } else {
      throw new IllegalArgumentException("Either text or pages is required");
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionRunResponse.summaryOf(run));
  }

  /** Starts a run from an uploaded PDF. */
  @PostMapping(value = "/pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionRunResponse> startPdfIngestion(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "numWorkers", required = false) Integer numWorkers) {
    IngestionRun run = ingestionService.startPdf(file, numWorkers);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionRunResponse.summaryOf(run));
  }

  /** Lists all runs, newest first. */
  @GetMapping
  public ResponseEntity<List<IngestionRunResponse>> listIngestions() {
    return ResponseEntity.ok(
        ingestionService.listRuns().stream().map(IngestionRunResponse::summaryOf).toList());
  }

  /** Gets a run with its chapter results. */
  @GetMapping("/{runId}")
  public ResponseEntity<IngestionRunResponse> getIngestion(@PathVariable String runId) {
    return ResponseEntity.ok(IngestionRunResponse.fromRun(ingestionService.getRun(runId)));
  }

  /** Stops a run. Chapters already in progress still finish. */
  @DeleteMapping("/{runId}")
  public ResponseEntity<IngestionRunResponse> stopIngestion(@PathVariable String runId) {
    IngestionRun run = ingestionService.stopRun(runId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionRunResponse.summaryOf(run));
  }
}
