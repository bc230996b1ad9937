package com.aireciudadano.acquisition.config;

import com.aireciudadano.acquisition.service.Aggregation;
import com.aireciudadano.acquisition.service.DuplicateStrategy;
import com.aireciudadano.acquisition.window.FetchMode;
import com.aireciudadano.acquisition.window.WindowFailurePolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the acquisition engine.
 *
 * <p>Values are bound from {@code acquisition.*} in {@code application.yml} and environment
 * variables. Everything here is a default; {@code AcquisitionRequest} overrides per call.
 */
@ConfigurationProperties(prefix = "acquisition")
public class AcquisitionProperties {
  private final Prometheus prometheus = new Prometheus();
  private final Labels labels = new Labels();
  private final Window window = new Window();
  private final Retry retry = new Retry();
  private final Fetch fetch = new Fetch();
  private final Assembly assembly = new Assembly();
  private final Resample resample = new Resample();

  public Prometheus getPrometheus() {
    return prometheus;
  }

  public Labels getLabels() {
    return labels;
  }

  public Window getWindow() {
    return window;
  }

  public Retry getRetry() {
    return retry;
  }

  public Fetch getFetch() {
    return fetch;
  }

  public Assembly getAssembly() {
    return assembly;
  }

  public Resample getResample() {
    return resample;
  }

  /** Backend endpoint and HTTP timeouts. */
  public static class Prometheus {
    private String baseUrl = "http://localhost:9090";
    private Duration queryTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private String defaultQuery = "{job=\"pushgateway\"}";

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public Duration getQueryTimeout() {
      return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public String getDefaultQuery() {
      return defaultQuery;
    }

    public void setDefaultQuery(String defaultQuery) {
      this.defaultQuery = defaultQuery;
    }
  }

  /** Label names that carry station and metric identity in backend series. */
  public static class Labels {
    private String station = "exported_job";
    private String metric = "__name__";

    public String getStation() {
      return station;
    }

    public void setStation(String station) {
      this.station = station;
    }

    public String getMetric() {
      return metric;
    }

    public void setMetric(String metric) {
      this.metric = metric;
    }
  }

  /** Window sizing and default query resolution. */
  public static class Window {
    private Duration maxSpan = Duration.ofHours(1);
    private Duration defaultStep = Duration.ofMinutes(1);

    public Duration getMaxSpan() {
      return maxSpan;
    }

    public void setMaxSpan(Duration maxSpan) {
      this.maxSpan = maxSpan;
    }

    public Duration getDefaultStep() {
      return defaultStep;
    }

    public void setDefaultStep(Duration defaultStep) {
      this.defaultStep = defaultStep;
    }
  }

  /** Retry policy for transient backend failures. */
  public static class Retry {
    private int maxRetries = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double multiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(10);

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }
  }

  /** Window scheduling, backend pacing, whole-request deadline and failed-window handling. */
  public static class Fetch {
    private FetchMode mode = FetchMode.SEQUENTIAL;
    private int parallelism = 4;
    private Duration minRequestInterval = Duration.ofSeconds(1);
    private Duration requestTimeout = Duration.ofMinutes(5);
    private WindowFailurePolicy windowFailurePolicy = WindowFailurePolicy.SKIP;

    public FetchMode getMode() {
      return mode;
    }

    public void setMode(FetchMode mode) {
      this.mode = mode;
    }

    public int getParallelism() {
      return parallelism;
    }

    public void setParallelism(int parallelism) {
      this.parallelism = parallelism;
    }

    public Duration getMinRequestInterval() {
      return minRequestInterval;
    }

    public void setMinRequestInterval(Duration minRequestInterval) {
      this.minRequestInterval = minRequestInterval;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }

    public WindowFailurePolicy getWindowFailurePolicy() {
      return windowFailurePolicy;
    }

    public void setWindowFailurePolicy(WindowFailurePolicy windowFailurePolicy) {
      this.windowFailurePolicy = windowFailurePolicy;
    }
  }

  /** Long-to-wide assembly defaults. */
  public static class Assembly {
    private DuplicateStrategy duplicateStrategy = DuplicateStrategy.MEAN;
    private List<String> zeroIsMissing = new ArrayList<>(List.of("Latitude", "Longitude"));
    private List<String> defaultMetrics =
        new ArrayList<>(List.of("PM25", "PM25raw", "PM1", "Humidity", "Temperature"));

    public DuplicateStrategy getDuplicateStrategy() {
      return duplicateStrategy;
    }

    public void setDuplicateStrategy(DuplicateStrategy duplicateStrategy) {
      this.duplicateStrategy = duplicateStrategy;
    }

    public List<String> getZeroIsMissing() {
      return zeroIsMissing;
    }

    public void setZeroIsMissing(List<String> zeroIsMissing) {
      this.zeroIsMissing = zeroIsMissing;
    }

    public List<String> getDefaultMetrics() {
      return defaultMetrics;
    }

    public void setDefaultMetrics(List<String> defaultMetrics) {
      this.defaultMetrics = defaultMetrics;
    }
  }

  /** Resampling defaults. */
  public static class Resample {
    private Aggregation defaultAggregation = Aggregation.MEAN;

    public Aggregation getDefaultAggregation() {
      return defaultAggregation;
    }

    public void setDefaultAggregation(Aggregation defaultAggregation) {
      this.defaultAggregation = defaultAggregation;
    }
  }
}
