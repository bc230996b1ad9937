package com.aireciudadano.acquisition.error;

/**
 * Caller input could not be used to build a backend query.
 */
public class InvalidRequestException extends AcquisitionException {
  public InvalidRequestException(String message) {
    super(message);
  }
}
