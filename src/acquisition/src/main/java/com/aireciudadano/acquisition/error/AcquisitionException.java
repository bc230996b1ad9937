package com.aireciudadano.acquisition.error;

/**
 * Base type for every failure surfaced by the acquisition engine.
 *
 * <p>Subclasses are unchecked so callers opt in to the cases they want to branch on.
 */
public abstract class AcquisitionException extends RuntimeException {
  protected AcquisitionException(String message) {
    super(message);
  }

  protected AcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
