package com.flamingo.ai.doctrine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.CheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.FileCheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.checkpoint.InMemoryCheckpointStore;
import com.flamingo.ai.doctrine.service.ingest.chunking.ChapterChunker;
import com.flamingo.ai.doctrine.service.ingest.extraction.DoctrinePromptBuilder;
import com.flamingo.ai.doctrine.service.ingest.extraction.DomainInference;
import com.flamingo.ai.doctrine.service.ingest.extraction.ExtractionResultParser;
import com.flamingo.ai.doctrine.service.ingest.extraction.VerbatimOverlapDetector;
import com.flamingo.ai.doctrine.service.ingest.progress.IngestProgressListener;
import com.flamingo.ai.doctrine.service.ingest.progress.ProgressFileWriter;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the stateless pieces of the extraction pipeline from {@link IngestConfig}. */
@Configuration
@Slf4j
public class PipelineConfig {

  @Bean
  public CheckpointStore checkpointStore(IngestConfig ingestConfig, ObjectMapper objectMapper) {
    IngestConfig.Checkpoint checkpoint = ingestConfig.getCheckpoint();
    String store = checkpoint.getStore() == null ? "file" : checkpoint.getStore().trim();
    switch (store.toLowerCase()) {
      case "memory":
        log.warn("Using in-memory checkpoints, progress will not survive a restart");
        return new InMemoryCheckpointStore();
      case "file":
        log.info("Using file checkpoints in {}", checkpoint.getDirectory());
        return new FileCheckpointStore(Path.of(checkpoint.getDirectory()), objectMapper);
      default:
        throw new IllegalStateException(
            "Unknown checkpoint store '" + store + "', expected 'file' or 'memory'");
    }
  }

  @Bean
  public ChapterChunker chapterChunker(IngestConfig ingestConfig) {
    return new ChapterChunker(ingestConfig.getChunking().getMaxChars());
  }

  @Bean
  public DomainInference domainInference(IngestConfig ingestConfig) {
    IngestConfig.Extraction extraction = ingestConfig.getExtraction();
    return new DomainInference(
        extraction.getDomainKeywords().isEmpty()
            ? DomainInference.DEFAULT_KEYWORDS
            : extraction.getDomainKeywords(),
        extraction.getFallbackDomain(),
        extraction.getMaxDomains());
  }

  @Bean
  public DoctrinePromptBuilder doctrinePromptBuilder(
      IngestConfig ingestConfig, DomainInference domainInference) {
    return new DoctrinePromptBuilder(
        domainInference.allowedDomains(), ingestConfig.getChunking().getMaxChars());
  }

  @Bean
  public ExtractionResultParser extractionResultParser(
      ObjectMapper objectMapper, DomainInference domainInference, IngestConfig ingestConfig) {
    return new ExtractionResultParser(
        objectMapper, domainInference, ingestConfig.getExtraction().getMaxDomains());
  }

  @Bean
  public VerbatimOverlapDetector verbatimOverlapDetector(IngestConfig ingestConfig) {
    IngestConfig.Extraction extraction = ingestConfig.getExtraction();
    return new VerbatimOverlapDetector(
        extraction.getVerbatimMinWords(), extraction.getVerbatimMaxWords());
  }

  @Bean
  public IngestProgressListener ingestProgressListener(
      IngestConfig ingestConfig, ObjectMapper objectMapper) {
    IngestConfig.Progress progress = ingestConfig.getProgress();
    if (!progress.isEnabled()) {
      return IngestProgressListener.NOOP;
    }
    return new ProgressFileWriter(Path.of(progress.getFile()), objectMapper);
  }
}
