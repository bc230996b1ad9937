package com.aireciudadano.acquisition.prometheus;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Spaces backend request starts by a minimum interval and caps requests in flight.
 *
 * <p>Shared by every acquisition running against the same backend; it holds no request data.
 */
@Component
public class RequestPacer {
  private final Semaphore permits;
  private final long minIntervalMs;
  private long nextAllowedAtMs;

  @Autowired
  public RequestPacer(AcquisitionProperties properties) {
    this(properties.getFetch().getParallelism(), properties.getFetch().getMinRequestInterval());
  }

  public RequestPacer(int maxInFlight, Duration minInterval) {
    this.permits = new Semaphore(Math.max(1, maxInFlight), true);
    this.minIntervalMs = minInterval == null ? 0L : Math.max(0L, minInterval.toMillis());
  }

  /**
   * Blocks until a request may start. Every successful call must be paired with {@link #release()}.
   *
   * @throws InterruptedException when the caller is interrupted while waiting
   */
  public void acquire() throws InterruptedException {
    permits.acquire();
    long waitMs;
    long slot;
    synchronized (this) {
      long now = System.currentTimeMillis();
      slot = Math.max(now, nextAllowedAtMs);
      nextAllowedAtMs = slot + minIntervalMs;
      waitMs = slot - now;
    }
    if (waitMs > 0) {
      try {
        Thread.sleep(waitMs);
      } catch (InterruptedException ex) {
        synchronized (this) {
          // Give the slot back unless a later caller already reserved after it.
          if (nextAllowedAtMs == slot + minIntervalMs) {
            nextAllowedAtMs = slot;
          }
        }
        permits.release();
        throw ex;
      }
    }
  }

  public void release() {
    permits.release();
  }

  int availablePermits() {
    return permits.availablePermits();
  }
}
