package com.flamingo.ai.doctrine.service.ingest.ratecontrol;

import com.flamingo.ai.doctrine.config.IngestConfig;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Concurrency gate for generation calls whose capacity follows observed latency and rate limits.
 *
 * <p>Permits are granted only while {@code inFlight < concurrency}. Shrinking the capacity never
 * revokes permits already granted; it only delays new ones until enough holders release.
 *
 * <p>Adjustment rules, applied by {@link #adjust()}:
 *
 * <ol>
 *   <li>rate-limit hits at or above the threshold: capacity x0.7 (floored at min), hits and latency
 *       window reset. Takes priority.
 *   <li>latency window full: average below the lower bound adds 2 (capped at max), above the upper
 *       bound multiplies by 0.9 (floored at min). The window is cleared either way.
 * </ol>
 *
 * <p>{@code adjust()} runs automatically after every {@code adjustEvery} recorded calls. All state
 * is guarded by a single lock.
 */
@Slf4j
public class AdaptiveRateController {

  private final int minConcurrency;
  private final int maxConcurrency;
  private final int adjustEvery;
  private final int rateLimitThreshold;
  private final int latencyWindowSize;
  private final Duration latencyLowerBound;
  private final Duration latencyUpperBound;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition permitAvailable = lock.newCondition();
  private final Deque<Duration> latencyWindow = new ArrayDeque<>();

  private int concurrency;
  private int inFlight;
  private int rateLimitHits;
  private long successes;
  private long recordedCalls;

  public AdaptiveRateController(
      int initialConcurrency,
      int minConcurrency,
      int maxConcurrency,
      int adjustEvery,
      int rateLimitThreshold,
      int latencyWindowSize,
      Duration latencyLowerBound,
      Duration latencyUpperBound) {
    if (minConcurrency < 1 || maxConcurrency < minConcurrency) {
      throw new IllegalArgumentException(
          "Invalid concurrency bounds: min=" + minConcurrency + ", max=" + maxConcurrency);
    }
    if (latencyLowerBound.compareTo(latencyUpperBound) > 0) {
      throw new IllegalArgumentException("Latency lower bound must not exceed upper bound");
    }
    this.minConcurrency = minConcurrency;
    this.maxConcurrency = maxConcurrency;
    this.adjustEvery = Math.max(1, adjustEvery);
    this.rateLimitThreshold = Math.max(1, rateLimitThreshold);
    this.latencyWindowSize = Math.max(1, latencyWindowSize);
    this.latencyLowerBound = latencyLowerBound;
    this.latencyUpperBound = latencyUpperBound;
    this.concurrency = clamp(initialConcurrency);
  }

  /**
   * Builds a controller from configuration, capping the initial and maximum capacity at the worker
   * count since a worker never holds more than one permit.
   */
  public static AdaptiveRateController fromConfig(IngestConfig.RateControl config, int numWorkers) {
    int max =
        Math.max(config.getMinConcurrency(), Math.min(config.getMaxConcurrency(), numWorkers));
    return new AdaptiveRateController(
        Math.min(config.getInitialConcurrency(), max),
        Math.min(config.getMinConcurrency(), max),
        max,
        config.getAdjustEvery(),
        config.getRateLimitThreshold(),
        config.getLatencyWindowSize(),
        config.getLatencyLowerBound(),
        config.getLatencyUpperBound());
  }

  /** Blocks until a permit is available. */
  public Permit acquire() throws InterruptedException {
    lock.lock();
    try {
      while (inFlight >= concurrency) {
        permitAvailable.await();
      }
      inFlight++;
      return new Permit();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for a permit.
   *
   * @return the permit, or {@code null} when the timeout elapsed first
   */
  public Permit tryAcquire(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (inFlight >= concurrency) {
        if (remaining <= 0) {
          return null;
        }
        remaining = permitAvailable.awaitNanos(remaining);
      }
      inFlight++;
      return new Permit();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for a permit and fails instead of returning {@code null}.
   *
   * @throws PermitTimeoutException when no permit became available in time
   */
  public Permit acquire(Duration timeout) throws InterruptedException {
    Permit permit = tryAcquire(timeout);
    if (permit == null) {
      throw new PermitTimeoutException(timeout);
    }
    return permit;
  }

  /** Returns a permit to the gate. Releasing the same permit twice has no effect. */
  public void release(Permit permit) {
    if (permit.owner() != this || !permit.released.compareAndSet(false, true)) {
      return;
    }
    lock.lock();
    try {
      inFlight--;
      permitAvailable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public void recordSuccess(Duration latency) {
    lock.lock();
    try {
      successes++;
      latencyWindow.addLast(latency);
      while (latencyWindow.size() > latencyWindowSize) {
        latencyWindow.removeFirst();
      }
      afterCall();
    } finally {
      lock.unlock();
    }
  }

  public void recordRateLimit() {
    lock.lock();
    try {
      rateLimitHits++;
      afterCall();
    } finally {
      lock.unlock();
    }
  }

  public void recordFailure() {
    lock.lock();
    try {
      afterCall();
    } finally {
      lock.unlock();
    }
  }

  /** Applies the adjustment rules once. */
  public void adjust() {
    lock.lock();
    try {
      int before = concurrency;
      if (rateLimitHits >= rateLimitThreshold) {
        concurrency = Math.max(minConcurrency, (int) Math.floor(concurrency * 0.7));
        rateLimitHits = 0;
        latencyWindow.clear();
        log.warn("Rate limit threshold reached, concurrency {} -> {}", before, concurrency);
      } else if (latencyWindow.size() >= latencyWindowSize) {
        double avgMillis =
            latencyWindow.stream().mapToLong(Duration::toMillis).average().orElse(0);
        if (avgMillis < latencyLowerBound.toMillis()) {
          concurrency = Math.min(maxConcurrency, concurrency + 2);
        } else if (avgMillis > latencyUpperBound.toMillis()) {
          concurrency = Math.max(minConcurrency, (int) Math.floor(concurrency * 0.9));
        }
        latencyWindow.clear();
        if (concurrency != before) {
          log.info(
              "Average latency {}ms, concurrency {} -> {}",
              Math.round(avgMillis),
              before,
              concurrency);
        }
      }
      if (concurrency > before) {
        permitAvailable.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  public RateControllerState state() {
    lock.lock();
    try {
      return new RateControllerState(
          concurrency,
          minConcurrency,
          maxConcurrency,
          inFlight,
          latencyWindow.stream().toList(),
          rateLimitHits,
          successes);
    } finally {
      lock.unlock();
    }
  }

  /** Current capacity, exposed for the concurrency gauge. */
  public int concurrency() {
    lock.lock();
    try {
      return concurrency;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock
  private void afterCall() {
    recordedCalls++;
    if (recordedCalls % adjustEvery == 0) {
      adjust();
    }
  }

  private int clamp(int value) {
    return Math.max(minConcurrency, Math.min(maxConcurrency, value));
  }

  /** Handle for one granted slot. Closing it releases the slot. */
  public final class Permit implements AutoCloseable {

    private final AtomicBoolean released = new AtomicBoolean();

    private Permit() {}

    private AdaptiveRateController owner() {
      return AdaptiveRateController.this;
    }

    @Override
    public void close() {
      release(this);
    }
  }

  /** Raised when a permit could not be obtained within the configured timeout. */
  public static class PermitTimeoutException extends RuntimeException {

    public PermitTimeoutException(Duration timeout) {
      super("No generation permit available within " + timeout.toSeconds() + "s");
    }
  }
}
