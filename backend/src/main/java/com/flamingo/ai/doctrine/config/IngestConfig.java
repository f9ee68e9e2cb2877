package com.flamingo.ai.doctrine.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
public class IngestConfig {

  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private RateControl rateControl = new RateControl();
  private Checkpoint checkpoint = new Checkpoint();
  private Pipeline pipeline = new Pipeline();
  private Metrics metrics = new Metrics();
  private Progress progress = new Progress();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk. Changing this invalidates existing checkpoints. */
    private int maxChars = 8000;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Model name passed to the generation capability. */
    private String model = "qwen2.5:7b-instruct";

    /** Per-call generation timeout. */
    private Duration timeout = Duration.ofSeconds(180);

    private int maxAttempts = 2;
    private int verbatimMinWords = 12;
    private int verbatimMaxWords = 20;

    /** Base delay before retrying a rate-limited call; doubled per attempt, capped at 32s. */
    private Duration rateLimitBackoff = Duration.ofSeconds(2);

    private int maxDomains = 3;

    /** Domain used when the model returns none and no keyword matches. */
    private String fallbackDomain = "strategy";

    /** Keyword table used to infer domains the model left out. */
    private Map<String, List<String>> domainKeywords = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class RateControl {
    private int initialConcurrency = 2;
    private int minConcurrency = 1;
    private int maxConcurrency = 8;

    /** Run {@code adjust()} after this many completed calls. */
    private int adjustEvery = 5;

    private int rateLimitThreshold = 3;
    private int latencyWindowSize = 10;

    /** Average latency below which concurrency is raised. */
    private Duration latencyLowerBound = Duration.ofSeconds(20);

    /** Average latency above which concurrency is lowered. */
    private Duration latencyUpperBound = Duration.ofSeconds(90);

    private Duration acquireTimeout = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Checkpoint {
    /** Backing store: "file" (default) or "memory". */
    private String store = "file";

    private String directory = "data/checkpoints";
  }

  @Getter
  @Setter
  public static class Pipeline {
    private int numWorkers = 2;
    private int queueCapacity = 500;

    /** Queue put/poll recheck interval, lets workers notice a stop request. */
    private Duration pollInterval = Duration.ofSeconds(5);

    /** Upper bound on waiting for all workers before missing chapters are marked failed. */
    private Duration resultsTimeout = Duration.ofHours(6);

    /** Runs executing at the same time; further runs wait in the run queue. */
    private int maxConcurrentRuns = 2;

    private int runQueueCapacity = 20;
  }

  @Getter
  @Setter
  public static class Metrics {
    private int latencyWindow = 1000;
  }

  @Getter
  @Setter
  public static class Progress {
    private boolean enabled = true;
    private String file = "data/progress.json";
  }
}
