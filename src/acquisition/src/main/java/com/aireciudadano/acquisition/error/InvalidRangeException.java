package com.aireciudadano.acquisition.error;

import java.time.Instant;

/**
 * Requested time range ends before it starts.
 */
public class InvalidRangeException extends InvalidRequestException {
  private final Instant start;
  private final Instant end;

  public InvalidRangeException(Instant start, Instant end) {
    super("range end " + end + " is before range start " + start);
    this.start = start;
    this.end = end;
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }
}
