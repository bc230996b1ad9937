package com.aireciudadano.acquisition.prometheus;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import java.time.Duration;

/**
 * Exponential backoff shared by every backend call.
 *
 * @param maxRetries retries after the first attempt
 * @param initialBackoff wait before the first retry
 * @param multiplier growth factor between consecutive retries
 * @param maxBackoff upper bound for a single wait
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
  }

  public static RetryPolicy from(AcquisitionProperties.Retry retry) {
    return new RetryPolicy(
        retry.getMaxRetries(), retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff());
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }

  /**
   * Wait before retry number {@code retry} (1-based).
   */
  public Duration backoffBefore(int retry) {
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(Math.max(0L, capped));
  }

  /**
   * Server faults, request timeouts and throttling are worth another attempt; other 4xx are not.
   */
  public boolean isRetryableStatus(int statusCode) {
    return statusCode >= 500 || statusCode == 408 || statusCode == 429;
  }
}
