package com.aireciudadano.acquisition.error;

import com.aireciudadano.acquisition.model.TimeWindow;

/**
 * Transport or HTTP failure that outlived the retry policy for one window.
 *
 * <p>Skipped by default: the acquisition continues with the remaining windows.
 */
public class WindowFetchFailedException extends AcquisitionException {
  private final TimeWindow window;
  private final int attempts;
  private final int lastStatusCode;

  public WindowFetchFailedException(
      TimeWindow window, int attempts, int lastStatusCode, String message, Throwable cause) {
    super(
        (window == null ? "backend query" : "window " + window) + " failed after " + attempts + " attempt(s)"
            + (lastStatusCode > 0 ? " (last status " + lastStatusCode + ")" : "")
            + ": " + message,
        cause);
    this.window = window;
    this.attempts = attempts;
    this.lastStatusCode = lastStatusCode;
  }

  /** Window being fetched, or {@code null} for instant and label queries. */
  public TimeWindow getWindow() {
    return window;
  }

  public int getAttempts() {
    return attempts;
  }

  /** Last HTTP status seen, or {@code 0} when the last attempt never got a response. */
  public int getLastStatusCode() {
    return lastStatusCode;
  }
}
