package com.aireciudadano.acquisition.error;

import com.aireciudadano.acquisition.model.TimeWindow;

/**
 * Backend rejected the query in a way retrying cannot fix (bad syntax, unprocessable query).
 *
 * <p>Aborts the whole acquisition.
 */
public class FatalBackendException extends AcquisitionException {
  private final TimeWindow window;
  private final int statusCode;
  private final String errorType;

  public FatalBackendException(
      TimeWindow window, int statusCode, String errorType, String backendMessage) {
    super(
        "backend rejected query"
            + (window == null ? "" : " for window " + window)
            + ": status=" + statusCode
            + ", errorType=" + errorType
            + ", error=" + backendMessage);
    this.window = window;
    this.statusCode = statusCode;
    this.errorType = errorType;
  }

  public TimeWindow getWindow() {
    return window;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getErrorType() {
    return errorType;
  }
}
