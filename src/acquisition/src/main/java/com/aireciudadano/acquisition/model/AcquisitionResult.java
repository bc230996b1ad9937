package com.aireciudadano.acquisition.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete output of one acquisition call: rows grouped by station plus window bookkeeping.
 *
 * @param start requested range start
 * @param end requested range end
 * @param metrics requested metric names, in output order
 * @param resampleInterval bucket width, or {@code null} for raw rows
 * @param data station to chronological rows, stations in ascending order
 * @param windowsPlanned number of windows the range was split into
 * @param failures windows that were skipped
 */
public record AcquisitionResult(
    Instant start,
    Instant end,
    List<String> metrics,
    Duration resampleInterval,
    Map<String, List<StationRecord>> data,
    int windowsPlanned,
    List<WindowFailure> failures) {

  public AcquisitionResult {
    metrics = List.copyOf(metrics);
    Map<String, List<StationRecord>> copy = new LinkedHashMap<>();
    data.forEach((station, rows) -> copy.put(station, List.copyOf(rows)));
    data = Collections.unmodifiableMap(copy);
    failures = List.copyOf(failures);
  }

  public int totalRecords() {
    return data.values().stream().mapToInt(List::size).sum();
  }

  public boolean isResampled() {
    return resampleInterval != null;
  }

  public boolean isComplete() {
    return failures.isEmpty();
  }
}
