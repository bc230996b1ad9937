package com.aireciudadano.acquisition.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Sub-range {@code [start, end)} of a requested range, sized to one backend query.
 */
public record TimeWindow(Instant start, Instant end) {
  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("window start must be before end: " + start + " / " + end);
    }
  }

  public Duration span() {
    return Duration.between(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
