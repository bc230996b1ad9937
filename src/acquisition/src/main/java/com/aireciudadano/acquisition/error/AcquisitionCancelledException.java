package com.aireciudadano.acquisition.error;

/**
 * Acquisition stopped before completion because the caller aborted it or the deadline passed.
 *
 * <p>No partial result accompanies this exception.
 */
public class AcquisitionCancelledException extends AcquisitionException {
  private final boolean timedOut;

  public AcquisitionCancelledException(String message, boolean timedOut) {
    super(message);
    this.timedOut = timedOut;
  }

  public AcquisitionCancelledException(String message, boolean timedOut, Throwable cause) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
