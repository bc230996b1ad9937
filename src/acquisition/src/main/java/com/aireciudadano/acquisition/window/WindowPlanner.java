package com.aireciudadano.acquisition.window;

import com.aireciudadano.acquisition.error.InvalidRangeException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a range into contiguous windows no wider than a maximum span.
 */
public final class WindowPlanner {
  private WindowPlanner() {}

  /**
   * Plans the windows covering {@code [rangeStart, rangeEnd)}.
   *
   * @param rangeStart inclusive start
   * @param rangeEnd exclusive end
   * @param maxWindowSpan upper bound for one window
   * @return ordered windows; empty when {@code rangeStart == rangeEnd}
   * @throws InvalidRangeException when {@code rangeEnd} is before {@code rangeStart}
   */
  public static List<TimeWindow> plan(Instant rangeStart, Instant rangeEnd, Duration maxWindowSpan) {
    if (rangeEnd.isBefore(rangeStart)) {
      throw new InvalidRangeException(rangeStart, rangeEnd);
    }
    if (maxWindowSpan == null || maxWindowSpan.isNegative() || maxWindowSpan.isZero()) {
      throw new IllegalArgumentException("maxWindowSpan must be > 0");
    }

    List<TimeWindow> windows = new ArrayList<>();
    Instant cursor = rangeStart;
    while (cursor.isBefore(rangeEnd)) {
      Instant candidate = cursor.plus(maxWindowSpan);
      Instant end = candidate.isBefore(rangeEnd) ? candidate : rangeEnd;
      windows.add(new TimeWindow(cursor, end));
      cursor = end;
    }
    return windows;
  }
}
