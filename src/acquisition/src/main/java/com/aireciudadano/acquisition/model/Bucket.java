package com.aireciudadano.acquisition.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates for one station over {@code [bucketStart, bucketStart + width)}.
 *
 * <p>A bucket with no contributing rows keeps every aggregate null.
 */
public record Bucket(String station, Instant bucketStart, Map<String, Double> aggregates)
    implements StationRecord {
  public Bucket {
    aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
  }

  @Override
  public Instant timestamp() {
    return bucketStart;
  }

  @Override
  public Map<String, Double> values() {
    return aggregates;
  }

  public boolean isEmpty() {
    return aggregates.values().stream().allMatch(v -> v == null);
  }
}
