package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.error.AcquisitionException;
import com.aireciudadano.acquisition.error.FatalBackendException;
import com.aireciudadano.acquisition.error.InvalidRangeException;
import com.aireciudadano.acquisition.error.InvalidRequestException;
import com.aireciudadano.acquisition.error.MalformedResponseException;
import com.aireciudadano.acquisition.error.NoDataException;
import com.aireciudadano.acquisition.error.WindowFetchFailedException;
import com.aireciudadano.acquisition.model.AcquisitionResult;
import com.aireciudadano.acquisition.model.FailureKind;
import com.aireciudadano.acquisition.model.Sample;
import com.aireciudadano.acquisition.model.StationRecord;
import com.aireciudadano.acquisition.model.TimeWindow;
import com.aireciudadano.acquisition.model.WideRow;
import com.aireciudadano.acquisition.model.WindowFailure;
import com.aireciudadano.acquisition.prometheus.PrometheusQueryClient;
import com.aireciudadano.acquisition.prometheus.StepTokens;
import com.aireciudadano.acquisition.prometheus.WindowFetchResult;
import com.aireciudadano.acquisition.window.WindowFailurePolicy;
import com.aireciudadano.acquisition.window.WindowFetchScheduler;
import com.aireciudadano.acquisition.window.WindowPlanner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of the acquisition engine.
 *
 * <p>Splits the requested range into windows, fetches and normalizes each window, pivots all
 * samples into wide rows, optionally resamples them into buckets, then filters and groups the rows
 * by station. Each call owns its accumulators; nothing is cached across calls.
 */
@Service
public class AcquisitionService {
  private static final Logger log = LoggerFactory.getLogger(AcquisitionService.class);

  private final AcquisitionProperties properties;
  private final PrometheusQueryClient client;
  private final WindowFetchScheduler scheduler;
  private final ExecutorService acquisitionExecutor;
  private final Clock clock;
  private final SampleNormalizer normalizer;
  private final Timer requestTimer;
  private final Counter windowsFailedCounter;
  private final Counter samplesDroppedCounter;

  /**
   * Creates the engine.
   *
   * @param properties typed engine configuration
   * @param client backend query client
   * @param scheduler window scheduling strategy
   * @param acquisitionExecutor executor running {@link #submit(AcquisitionRequest)} calls
   * @param clock clock used for snapshot evaluation time
   * @param meterRegistry registry for engine metrics
   */
  public AcquisitionService(
      AcquisitionProperties properties,
      PrometheusQueryClient client,
      WindowFetchScheduler scheduler,
      @Qualifier("acquisitionExecutor") ExecutorService acquisitionExecutor,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.client = client;
    this.scheduler = scheduler;
    this.acquisitionExecutor = acquisitionExecutor;
    this.clock = clock;
    this.normalizer = new SampleNormalizer(
        properties.getLabels().getStation(), properties.getLabels().getMetric());
    this.requestTimer = Timer.builder("acquisition.requests.duration")
        .description("Duration of complete acquisition calls")
        .register(meterRegistry);
    this.windowsFailedCounter = Counter.builder("acquisition.windows.failed.total")
        .description("Windows skipped after exhausted retries or malformed responses")
        .register(meterRegistry);
    this.samplesDroppedCounter = Counter.builder("acquisition.samples.dropped.total")
        .description("Series entries and values dropped during normalization")
        .register(meterRegistry);
  }

  @PostConstruct
  public void logConfiguration() {
    log.info(
        "Acquisition engine configured: backend={}, maxWindowSpan={}, mode={}, parallelism={}, "
            + "maxRetries={}, minRequestInterval={}, windowFailurePolicy={}",
        properties.getPrometheus().getBaseUrl(),
        properties.getWindow().getMaxSpan(),
        scheduler.mode(),
        properties.getFetch().getParallelism(),
        properties.getRetry().getMaxRetries(),
        properties.getFetch().getMinRequestInterval(),
        properties.getFetch().getWindowFailurePolicy());
  }

  /**
   * Runs a complete acquisition on the calling thread.
   *
   * <p>Interrupting the calling thread, or exceeding the request timeout, stops the acquisition and
   * discards everything fetched so far.
   *
   * @param request request configuration
   * @return rows grouped by station, possibly with skipped windows listed
   * @throws InvalidRequestException when the request cannot be executed
   * @throws FatalBackendException when the backend rejects the query
   * @throws WindowFetchFailedException when a window fails under {@link WindowFailurePolicy#ABORT}
   * @throws MalformedResponseException when a window is malformed under {@link WindowFailurePolicy#ABORT}
   * @throws NoDataException when no window produced a usable sample
   * @throws AcquisitionCancelledException on interrupt or timeout
   */
  public AcquisitionResult acquire(AcquisitionRequest request) {
    Plan plan = resolve(request);
    List<TimeWindow> windows = WindowPlanner.plan(request.start(), request.end(), plan.maxWindowSpan());
    if (windows.isEmpty()) {
      log.info("Empty range at {}, nothing to acquire", request.start());
      return new AcquisitionResult(
          request.start(), request.end(), plan.metrics(), request.resampleInterval(), Map.of(), 0, List.of());
    }

    log.info(
        "Acquiring {} over [{}, {}) in {} window(s), step={}, resample={}, mode={}",
        plan.metrics(),
        request.start(),
        request.end(),
        windows.size(),
        StepTokens.formatStep(plan.step()),
        request.isResampled() ? StepTokens.formatStep(request.resampleInterval()) : "none",
        scheduler.mode());

    long startedNs = System.nanoTime();
    List<WindowOutcome> outcomes;
    try {
      outcomes = scheduler.run(windows, window -> fetchWindow(window, plan), plan.timeout());
    } catch (AcquisitionCancelledException ex) {
      log.warn("Acquisition over [{}, {}) cancelled: {}", request.start(), request.end(), ex.getMessage());
      throw ex;
    } catch (FatalBackendException | WindowFetchFailedException | MalformedResponseException ex) {
      log.error("Acquisition over [{}, {}) aborted: {}", request.start(), request.end(), ex.getMessage());
      throw ex;
    } finally {
      requestTimer.record(System.nanoTime() - startedNs, TimeUnit.NANOSECONDS);
    }

    List<WindowFailure> failures = new ArrayList<>();
    List<Sample> samples = new ArrayList<>();
    for (WindowOutcome outcome : outcomes) {
      if (outcome.failure() != null) {
        failures.add(outcome.failure());
      }
      samples.addAll(outcome.samples());
    }
    if (samples.isEmpty()) {
      log.warn("No data over [{}, {}): {} window(s), {} failed", request.start(), request.end(),
          windows.size(), failures.size());
      throw new NoDataException(windows.size(), failures);
    }

    List<WideRow> rows = WideTableAssembler.assemble(
        samples, plan.metrics(), plan.duplicateStrategy(), plan.zeroIsMissing());

    List<? extends StationRecord> records;
    if (request.isResampled()) {
      records = Resampler.resample(
          rows,
          request.start(),
          request.end(),
          request.resampleInterval(),
          plan.metrics(),
          request.metricAggregations(),
          plan.aggregation());
    } else {
      records = clipToRange(rows, request.start(), request.end());
    }

    AcquisitionResult result = new AcquisitionResult(
        request.start(),
        request.end(),
        plan.metrics(),
        request.resampleInterval(),
        request.stationFilter().filterAndGroup(records),
        windows.size(),
        failures);
    log.info(
        "Acquired {} record(s) for {} station(s) from {} sample(s); {} of {} window(s) skipped",
        result.totalRecords(),
        result.data().size(),
        samples.size(),
        failures.size(),
        windows.size());
    return result;
  }

  /**
   * Runs {@link #acquire(AcquisitionRequest)} on the acquisition executor.
   *
   * <p>{@code future.cancel(true)} aborts the acquisition; no partial result is kept.
   *
   * @param request request configuration
   * @return pending result
   */
  public Future<AcquisitionResult> submit(AcquisitionRequest request) {
    resolve(request);
    return acquisitionExecutor.submit(() -> acquire(request));
  }

  /**
   * Reads the latest value of each series with one instant query.
   *
   * @param query PromQL selector or expression, null for the configured default
   * @param metrics requested metric names, empty for the configured defaults
   * @param stationFilter include/exclude station patterns
   * @param time evaluation time, null for now
   * @return one row per station and reported timestamp
   * @throws NoDataException when the backend returned no usable sample
   */
  public AcquisitionResult snapshot(
      String query, List<String> metrics, StationFilter stationFilter, Instant time) {
    Instant at = time == null ? clock.instant() : time;
    List<String> columns = resolveMetrics(metrics);
    String effectiveQuery = resolveQuery(query);

    log.info("Snapshot of {} at {}", columns, at);
    SampleNormalizer.Normalization normalization = normalizer.normalize(client.queryInstant(effectiveQuery, at));
    samplesDroppedCounter.increment(normalization.droppedEntries() + normalization.droppedValues());
    if (normalization.samples().isEmpty()) {
      throw new NoDataException(1, List.of());
    }

    List<WideRow> rows = WideTableAssembler.assemble(
        normalization.samples(),
        columns,
        properties.getAssembly().getDuplicateStrategy(),
        new HashSet<>(properties.getAssembly().getZeroIsMissing()));
    StationFilter filter = stationFilter == null ? StationFilter.none() : stationFilter;
    return new AcquisitionResult(at, at, columns, null, filter.filterAndGroup(rows), 1, List.of());
  }

  private WindowOutcome fetchWindow(TimeWindow window, Plan plan) {
    WindowFetchResult fetched = client.fetchRange(window, plan.query(), plan.step());
    if (!fetched.isSuccess()) {
      AcquisitionException failure = fetched.failure();
      FailureKind kind = failure instanceof MalformedResponseException
          ? FailureKind.MALFORMED_RESPONSE
          : FailureKind.WINDOW_FETCH_FAILED;
      windowsFailedCounter.increment();
      if (plan.windowFailurePolicy() == WindowFailurePolicy.ABORT) {
        throw failure;
      }
      log.warn("Skipping window {} ({}, {} attempt(s)): {}", window, kind, fetched.attempts(), failure.getMessage());
      return new WindowOutcome(
          List.of(), new WindowFailure(window, kind, fetched.attempts(), failure.getMessage()));
    }

    SampleNormalizer.Normalization normalization = normalizer.normalize(fetched.body());
    int dropped = normalization.droppedEntries() + normalization.droppedValues();
    if (dropped > 0) {
      samplesDroppedCounter.increment(dropped);
    }
    log.debug("Window {} returned {} sample(s), dropped {}", window, normalization.samples().size(), dropped);
    return new WindowOutcome(normalization.samples(), null);
  }

  private List<WideRow> clipToRange(List<WideRow> rows, Instant start, Instant end) {
    // Range queries are inclusive at both ends.
    List<WideRow> clipped = new ArrayList<>(rows.size());
    for (WideRow row : rows) {
      if (!row.timestamp().isBefore(start) && !row.timestamp().isAfter(end)) {
        clipped.add(row);
      }
    }
    return clipped;
  }

  private Plan resolve(AcquisitionRequest request) {
    if (request.end().isBefore(request.start())) {
      throw new InvalidRangeException(request.start(), request.end());
    }
    if (request.resampleInterval() != null
        && (request.resampleInterval().isNegative() || request.resampleInterval().isZero())) {
      throw new InvalidRequestException("resample interval must be > 0");
    }

    Duration step = request.step() == null ? properties.getWindow().getDefaultStep() : request.step();
    StepTokens.formatStep(step);
    Duration maxWindowSpan = request.maxWindowSpan() == null
        ? properties.getWindow().getMaxSpan()
        : request.maxWindowSpan();
    if (maxWindowSpan == null || maxWindowSpan.isNegative() || maxWindowSpan.isZero()) {
      throw new InvalidRequestException("max window span must be > 0");
    }
    Duration timeout = request.timeout() == null ? properties.getFetch().getRequestTimeout() : request.timeout();
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new InvalidRequestException("timeout must be > 0");
    }

    Set<String> zeroIsMissing = request.zeroIsMissing() == null
        ? new HashSet<>(properties.getAssembly().getZeroIsMissing())
        : request.zeroIsMissing();
    return new Plan(
        resolveQuery(request.query()),
        resolveMetrics(request.metrics()),
        step,
        maxWindowSpan,
        timeout,
        request.duplicateStrategy() == null
            ? properties.getAssembly().getDuplicateStrategy()
            : request.duplicateStrategy(),
        zeroIsMissing,
        request.aggregation() == null
            ? properties.getResample().getDefaultAggregation()
            : request.aggregation(),
        request.windowFailurePolicy() == null
            ? properties.getFetch().getWindowFailurePolicy()
            : request.windowFailurePolicy());
  }

  private String resolveQuery(String query) {
    String effective = query == null || query.isBlank() ? properties.getPrometheus().getDefaultQuery() : query;
    if (effective == null || effective.isBlank()) {
      throw new InvalidRequestException("query must not be empty");
    }
    return effective;
  }

  private List<String> resolveMetrics(List<String> metrics) {
    List<String> effective = metrics == null || metrics.isEmpty()
        ? properties.getAssembly().getDefaultMetrics()
        : metrics;
    if (effective == null || effective.isEmpty()) {
      throw new InvalidRequestException("at least one metric must be requested");
    }
    return List.copyOf(new LinkedHashSet<>(effective));
  }

  private record Plan(
      String query,
      List<String> metrics,
      Duration step,
      Duration maxWindowSpan,
      Duration timeout,
      DuplicateStrategy duplicateStrategy,
      Set<String> zeroIsMissing,
      Aggregation aggregation,
      WindowFailurePolicy windowFailurePolicy) {}

  private record WindowOutcome(List<Sample> samples, WindowFailure failure) {}
}
