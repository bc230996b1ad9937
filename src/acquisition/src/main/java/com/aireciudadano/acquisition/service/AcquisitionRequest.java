package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.window.WindowFailurePolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything one acquisition call needs. Optional fields left null fall back to the configured
 * defaults in {@code AcquisitionProperties}.
 *
 * @param query PromQL selector or expression; null uses the configured default query
 * @param start inclusive range start
 * @param end range end
 * @param metrics requested metric names, output column order; empty uses the configured defaults
 * @param resampleInterval bucket width, or null to return raw rows
 * @param step backend query resolution, or null for the configured default step
 * @param stationFilter include/exclude station patterns
 * @param aggregation bucket aggregation for metrics without an override, or null for the default
 * @param metricAggregations per-metric bucket aggregation overrides
 * @param duplicateStrategy reconciliation for duplicate samples, or null for the default
 * @param zeroIsMissing metrics whose zero means "unset", or null for the configured set
 * @param maxWindowSpan upper bound for one backend query window, or null for the default
 * @param timeout whole-call deadline, or null for the configured request timeout
 * @param windowFailurePolicy skip or abort on a failed window, or null for the configured policy
 */
public record AcquisitionRequest(
    String query,
    Instant start,
    Instant end,
    List<String> metrics,
    Duration resampleInterval,
    Duration step,
    StationFilter stationFilter,
    Aggregation aggregation,
    Map<String, Aggregation> metricAggregations,
    DuplicateStrategy duplicateStrategy,
    Set<String> zeroIsMissing,
    Duration maxWindowSpan,
    Duration timeout,
    WindowFailurePolicy windowFailurePolicy) {

  public AcquisitionRequest {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    metrics = metrics == null ? List.of() : List.copyOf(new LinkedHashSet<>(metrics));
    stationFilter = stationFilter == null ? StationFilter.none() : stationFilter;
    metricAggregations = metricAggregations == null ? Map.of() : Map.copyOf(metricAggregations);
    zeroIsMissing = zeroIsMissing == null ? null : Set.copyOf(zeroIsMissing);
  }

  public static Builder builder(Instant start, Instant end) {
    return new Builder(start, end);
  }

  public boolean isResampled() {
    return resampleInterval != null;
  }

  /** Fluent construction for callers that only set a few fields. */
  public static final class Builder {
    private final Instant start;
    private final Instant end;
    private String query;
    private List<String> metrics = List.of();
    private Duration resampleInterval;
    private Duration step;
    private StationFilter stationFilter = StationFilter.none();
    private Aggregation aggregation;
    private final Map<String, Aggregation> metricAggregations = new LinkedHashMap<>();
    private DuplicateStrategy duplicateStrategy;
    private Set<String> zeroIsMissing;
    private Duration maxWindowSpan;
    private Duration timeout;
    private WindowFailurePolicy windowFailurePolicy;

    private Builder(Instant start, Instant end) {
      this.start = start;
      this.end = end;
    }

    public Builder query(String query) {
      this.query = query;
      return this;
    }

    public Builder metrics(List<String> metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder metrics(String... metrics) {
      this.metrics = List.of(metrics);
      return this;
    }

    public Builder resampleInterval(Duration resampleInterval) {
      this.resampleInterval = resampleInterval;
      return this;
    }

    public Builder step(Duration step) {
      this.step = step;
      return this;
    }

    public Builder stationFilter(StationFilter stationFilter) {
      this.stationFilter = stationFilter;
      return this;
    }

    public Builder aggregation(Aggregation aggregation) {
      this.aggregation = aggregation;
      return this;
    }

    public Builder aggregation(String metric, Aggregation aggregation) {
      this.metricAggregations.put(metric, aggregation);
      return this;
    }

    public Builder duplicateStrategy(DuplicateStrategy duplicateStrategy) {
      this.duplicateStrategy = duplicateStrategy;
      return this;
    }

    public Builder zeroIsMissing(Set<String> zeroIsMissing) {
      this.zeroIsMissing = zeroIsMissing;
      return this;
    }

    public Builder maxWindowSpan(Duration maxWindowSpan) {
      this.maxWindowSpan = maxWindowSpan;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder windowFailurePolicy(WindowFailurePolicy windowFailurePolicy) {
      this.windowFailurePolicy = windowFailurePolicy;
      return this;
    }

    public AcquisitionRequest build() {
      return new AcquisitionRequest(
          query,
          start,
          end,
          metrics,
          resampleInterval,
          step,
          stationFilter,
          aggregation,
          metricAggregations,
          duplicateStrategy,
          zeroIsMissing,
          maxWindowSpan,
          timeout,
          windowFailurePolicy);
    }
  }
}
