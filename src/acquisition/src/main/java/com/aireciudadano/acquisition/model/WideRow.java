package com.aireciudadano.acquisition.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row per {@code (station, timestamp)} with one entry per requested metric.
 *
 * <p>{@code metrics} keeps insertion order and may hold null values.
 */
public record WideRow(String station, Instant timestamp, Map<String, Double> metrics)
    implements StationRecord {
  public WideRow {
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }

  @Override
  public Map<String, Double> values() {
    return metrics;
  }
}
