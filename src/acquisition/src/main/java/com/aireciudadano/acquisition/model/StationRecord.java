package com.aireciudadano.acquisition.model;

import java.time.Instant;
import java.util.Map;

/**
 * Row shape shared by assembled rows and resampled buckets, as consumed by filtering, grouping and
 * serialization.
 */
public interface StationRecord {
  String station();

  /** Row timestamp, or bucket start for resampled rows. */
  Instant timestamp();

  /** Metric values keyed by requested metric name, in request order; values may be null. */
  Map<String, Double> values();
}
