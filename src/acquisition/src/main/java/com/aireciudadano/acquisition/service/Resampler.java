package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.error.InvalidRangeException;
import com.aireciudadano.acquisition.model.Bucket;
import com.aireciudadano.acquisition.model.StationRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets rows into fixed-width intervals anchored at the range start.
 *
 * <p>Buckets are {@code [start + i * width, start + (i + 1) * width)} for every {@code i} whose
 * bucket overlaps {@code [start, end)}. Every station gets the full sequence: a bucket without rows
 * is emitted with null aggregates, never skipped. Rows outside the range are ignored.
 */
public final class Resampler {
  private Resampler() {}

  /**
   * @param rows rows for any number of stations, any order
   * @param start range start, first bucket start
   * @param end exclusive range end
   * @param width bucket width
   * @param metrics metric names to aggregate, in output order
   * @param aggregations per-metric overrides
   * @param defaultAggregation aggregation for metrics without an override
   * @return buckets ordered by station then bucket start
   */
  public static List<Bucket> resample(
      Collection<? extends StationRecord> rows,
      Instant start,
      Instant end,
      Duration width,
      List<String> metrics,
      Map<String, Aggregation> aggregations,
      Aggregation defaultAggregation) {
    if (width == null || width.isNegative() || width.isZero()) {
      throw new IllegalArgumentException("resample width must be > 0");
    }
    if (end.isBefore(start)) {
      throw new InvalidRangeException(start, end);
    }

    int bucketCount = bucketCount(start, end, width);
    Map<String, List<StationRecord>> byStation = new TreeMap<>();
    for (StationRecord row : rows) {
      byStation.computeIfAbsent(row.station(), ignored -> new ArrayList<>()).add(row);
    }

    List<Bucket> buckets = new ArrayList<>();
    for (Map.Entry<String, List<StationRecord>> entry : byStation.entrySet()) {
      List<StationRecord> stationRows = entry.getValue();
      stationRows.sort(Comparator.comparing(StationRecord::timestamp));

      List<Map<String, List<Double>>> contributions = new ArrayList<>(bucketCount);
      for (int i = 0; i < bucketCount; i++) {
        contributions.add(new LinkedHashMap<>());
      }
      for (StationRecord row : stationRows) {
        Instant timestamp = row.timestamp();
        if (timestamp.isBefore(start) || !timestamp.isBefore(end)) {
          continue;
        }
        int index = (int) Duration.between(start, timestamp).dividedBy(width);
        Map<String, List<Double>> bucket = contributions.get(index);
        for (String metric : metrics) {
          Double value = row.values().get(metric);
          if (value != null) {
            bucket.computeIfAbsent(metric, ignored -> new ArrayList<>()).add(value);
          }
        }
      }

      for (int i = 0; i < bucketCount; i++) {
        Map<String, Double> aggregates = new LinkedHashMap<>();
        for (String metric : metrics) {
          Aggregation aggregation = aggregations.getOrDefault(metric, defaultAggregation);
          aggregates.put(metric, aggregation.apply(contributions.get(i).get(metric)));
        }
        buckets.add(new Bucket(entry.getKey(), start.plus(width.multipliedBy(i)), aggregates));
      }
    }
    return buckets;
  }

  /**
   * Number of buckets overlapping {@code [start, end)}: {@code ceil((end - start) / width)}.
   */
  public static int bucketCount(Instant start, Instant end, Duration width) {
    Duration span = Duration.between(start, end);
    long whole = span.dividedBy(width);
    boolean partial = !span.minus(width.multipliedBy(whole)).isZero();
    long count = whole + (partial ? 1 : 0);
    if (count > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("too many buckets for range " + span + " and width " + width);
    }
    return (int) count;
  }
}
