package com.flamingo.ai.doctrine.service.ingest.ratecontrol;

import java.time.Duration;
import java.util.List;

/**
 * Point-in-time view of an {@link AdaptiveRateController}.
 *
 * @param concurrency current gate capacity
 * @param minConcurrency lower bound
 * @param maxConcurrency upper bound
 * @param inFlight permits currently held
 * @param latencyWindow latencies recorded since the last adjustment
 * @param rateLimitHits rate-limit signals since the last back-off
 * @param successes successful calls over the controller lifetime
 */
public record RateControllerState(
    int concurrency,
    int minConcurrency,
    int maxConcurrency,
    int inFlight,
    List<Duration> latencyWindow,
    int rateLimitHits,
    long successes) {

  public RateControllerState {
    latencyWindow = List.copyOf(latencyWindow);
  }
}
