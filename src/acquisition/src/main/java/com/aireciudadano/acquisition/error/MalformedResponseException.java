package com.aireciudadano.acquisition.error;

import com.aireciudadano.acquisition.model.TimeWindow;

/**
 * Backend answered 2xx but the body does not have the expected envelope.
 */
public class MalformedResponseException extends AcquisitionException {
  private final TimeWindow window;

  public MalformedResponseException(TimeWindow window, String message) {
    super(describe(window) + message);
    this.window = window;
  }

  public MalformedResponseException(TimeWindow window, String message, Throwable cause) {
    super(describe(window) + message, cause);
    this.window = window;
  }

  /** Window being fetched, or {@code null} for instant and label queries. */
  public TimeWindow getWindow() {
    return window;
  }

  private static String describe(TimeWindow window) {
    return window == null ? "malformed response: " : "malformed response for window " + window + ": ";
  }
}
