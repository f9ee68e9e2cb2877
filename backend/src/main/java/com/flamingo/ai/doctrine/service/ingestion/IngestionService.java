package com.flamingo.ai.doctrine.service.ingestion;

import com.flamingo.ai.doctrine.config.IngestConfig;
import com.flamingo.ai.doctrine.exception.DocumentProcessingException;
import com.flamingo.ai.doctrine.exception.IngestionRunNotFoundException;
import com.flamingo.ai.doctrine.service.document.ChapterSplitter;
import com.flamingo.ai.doctrine.service.document.Document;
import com.flamingo.ai.doctrine.service.document.PdfPageExtractor;
import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Accepts documents, starts ingestion runs and keeps track of them. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  static final int MAX_WORKERS = 32;

  private final ChapterSplitter chapterSplitter;
  private final PdfPageExtractor pdfPageExtractor;
  private final IngestionRunner ingestionRunner;
  private final IngestConfig ingestConfig;

  private final Map<String, IngestionRun> runs = new ConcurrentHashMap<>();

  public IngestionRun startText(String name, String text, Integer numWorkers) {
    return start(Document.ofText(name, text), numWorkers);
  }

  public IngestionRun startPages(String name, List<String> pages, Integer numWorkers) {
    return start(new Document(name, pages), numWorkers);
  }

  public IngestionRun startPdf(MultipartFile file, Integer numWorkers) {
    String fileName =
        file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.pdf";
    if (file.isEmpty()) {
      throw new DocumentProcessingException(fileName, "Uploaded file is empty");
    }
    try (InputStream inputStream = file.getInputStream()) {
      return start(pdfPageExtractor.extract(fileName, inputStream), numWorkers);
    } catch (IOException e) {
      throw new DocumentProcessingException(fileName, "Failed to read upload", e);
    }
  }

  /**
   * Splits the document and hands it to the runner.
   *
   * @throws DocumentProcessingException when the document has no text
   * @throws TaskRejectedException when the run queue is full
   */
  public IngestionRun start(Document document, Integer numWorkers) {
    int workers = resolveWorkers(numWorkers);
    if (document.isBlank()) {
      throw new DocumentProcessingException(document.name(), "Document contains no text");
    }
    List<Chapter> chapters = chapterSplitter.split(document);
    if (chapters.isEmpty()) {
      throw new DocumentProcessingException(document.name(), "Document contains no chapters");
    }

    IngestionRun run = new IngestionRun(document.name(), workers, chapters.size());
    runs.put(run.getId(), run);
    log.info("Accepted run {} for {} ({} chapters)", run.getId(), document.name(), chapters.size());
    try {
      ingestionRunner.runAsync(run, chapters);
    } catch (TaskRejectedException e) {
      runs.remove(run.getId());
      log.warn("Run queue full, rejected {}", document.name());
      throw e;
    }
    return run;
  }

  public IngestionRun getRun(String runId) {
    IngestionRun run = runs.get(runId);
    if (run == null) {
      throw new IngestionRunNotFoundException(runId);
    }
    return run;
  }

  public List<IngestionRun> listRuns() {
    return runs.values().stream()
        .sorted(Comparator.comparing(IngestionRun::getCreatedAt).reversed())
        .toList();
  }

  /** Requests a stop; chapters already in progress still finish. */
  public IngestionRun stopRun(String runId) {
    IngestionRun run = getRun(runId);
    if (run.requestStop()) {
      log.info("Stop requested for run {}", runId);
    } else {
      log.debug("Run {} already finished with status {}", runId, run.getStatus());
    }
    return run;
  }

  private int resolveWorkers(Integer numWorkers) {
    int workers = numWorkers != null ? numWorkers : ingestConfig.getPipeline().getNumWorkers();
    if (workers < 1 || workers > MAX_WORKERS) {
      throw new IllegalArgumentException(
          "numWorkers must be between 1 and " + MAX_WORKERS + ": " + workers);
    }
    return workers;
  }
}
