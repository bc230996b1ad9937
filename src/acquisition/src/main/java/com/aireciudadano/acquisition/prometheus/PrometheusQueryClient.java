package com.aireciudadano.acquisition.prometheus;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.error.FatalBackendException;
import com.aireciudadano.acquisition.error.MalformedResponseException;
import com.aireciudadano.acquisition.error.WindowFetchFailedException;
import com.aireciudadano.acquisition.model.TimeWindow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Prometheus query API ({@code query_range}, {@code query}, label values).
 *
 * <p>Transient failures are retried with the shared {@link RetryPolicy}. Range queries report
 * exhausted retries and malformed bodies as values so the caller can skip the window; queries the
 * backend rejects outright raise {@link FatalBackendException}.
 */
@Component
public class PrometheusQueryClient {
  private static final Logger log = LoggerFactory.getLogger(PrometheusQueryClient.class);

  private final AcquisitionProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;
  private final RequestPacer pacer;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter retryableCounter;
  private final Counter fatalCounter;
  private final Counter malformedCounter;
  private final Counter exceptionCounter;
  private final Counter retriesCounter;

  public PrometheusQueryClient(
      AcquisitionProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RetryPolicy retryPolicy,
      RequestPacer pacer,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.retryPolicy = retryPolicy;
    this.pacer = pacer;

    this.requestTimer = Timer.builder("acquisition.prometheus.http.duration")
        .description("Prometheus query HTTP request duration (seconds)")
        .register(meterRegistry);

    // Keep cardinality low: outcomes only, no query or window labels.
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.retryableCounter = outcomeCounter(meterRegistry, "retryable");
    this.fatalCounter = outcomeCounter(meterRegistry, "fatal");
    this.malformedCounter = outcomeCounter(meterRegistry, "malformed");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
    this.retriesCounter = Counter.builder("acquisition.prometheus.retries.total")
        .description("Prometheus query retries after a transient failure")
        .register(meterRegistry);
  }

  /**
   * Runs one range query for a window.
   *
   * @param window window bounds, sent as closed {@code start}/{@code end}
   * @param query PromQL selector or expression
   * @param step query resolution
   * @return parsed body, or the skippable failure for this window
   * @throws FatalBackendException when the backend rejects the query
   * @throws AcquisitionCancelledException when the calling thread is interrupted
   */
  public WindowFetchResult fetchRange(TimeWindow window, String query, Duration step) {
    URI uri = URI.create(baseUrl()
        + "/api/v1/query_range?query=" + encode(query)
        + "&start=" + encode(window.start().toString())
        + "&end=" + encode(window.end().toString())
        + "&step=" + encode(StepTokens.formatStep(step)));

    Exchange exchange;
    try {
      exchange = exchange(uri, window);
    } catch (WindowFetchFailedException ex) {
      return WindowFetchResult.failed(window, ex, ex.getAttempts());
    }

    try {
      JsonNode root = parseEnvelope(exchange, window);
      requireResultArray(root, window);
      return WindowFetchResult.success(window, root, exchange.attempts());
    } catch (MalformedResponseException ex) {
      malformedCounter.increment();
      return WindowFetchResult.failed(window, ex, exchange.attempts());
    }
  }

  /**
   * Runs one instant query.
   *
   * @param query PromQL selector or expression
   * @param time evaluation time, or {@code null} for the backend's current time
   * @return parsed response envelope
   */
  public JsonNode queryInstant(String query, Instant time) {
    String url = baseUrl() + "/api/v1/query?query=" + encode(query);
    if (time != null) {
      url += "&time=" + encode(time.toString());
    }
    Exchange exchange = exchange(URI.create(url), null);
    JsonNode root = parseEnvelope(exchange, null);
    requireResultArray(root, null);
    return root;
  }

  /**
   * Lists the values a label takes across all series.
   *
   * @param label label name
   * @return label values as reported by the backend
   */
  public List<String> labelValues(String label) {
    URI uri = URI.create(baseUrl() + "/api/v1/label/" + encode(label) + "/values");
    Exchange exchange = exchange(uri, null);
    JsonNode data = parseEnvelope(exchange, null).path("data");
    if (!data.isArray()) {
      malformedCounter.increment();
      throw new MalformedResponseException(null, "label values response has no data array");
    }
    List<String> values = new ArrayList<>(data.size());
    for (JsonNode value : data) {
      if (value.isTextual()) {
        values.add(value.asText());
      }
    }
    return values;
  }

  private Exchange exchange(URI uri, TimeWindow window) {
    Duration timeout = properties.getPrometheus().getQueryTimeout();
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(timeout == null ? Duration.ofSeconds(30) : timeout)
        .header("Accept", "application/json")
        .GET()
        .build();

    int attempt = 0;
    int lastStatus = 0;
    String lastError = "no attempt made";
    Throwable lastCause = null;
    while (attempt < retryPolicy.maxAttempts()) {
      if (attempt > 0) {
        Duration backoff = retryPolicy.backoffBefore(attempt);
        log.warn(
            "Retrying Prometheus query for window {} in {} ms (retry {}/{}): {}",
            window == null ? "-" : window,
            backoff.toMillis(),
            attempt,
            retryPolicy.maxRetries(),
            lastError);
        retriesCounter.increment();
        sleep(backoff);
      }
      if (Thread.currentThread().isInterrupted()) {
        throw new AcquisitionCancelledException("acquisition interrupted before backend request", false);
      }
      attempt++;

      long httpStartNs = System.nanoTime();
      HttpResponse<String> response;
      try {
        pacer.acquire();
        try {
          log.debug("Prometheus request attempt {}: {}", attempt, uri);
          httpStartNs = System.nanoTime();
          response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } finally {
          pacer.release();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        exceptionCounter.increment();
        throw new AcquisitionCancelledException("acquisition interrupted during backend request", false, ex);
      } catch (IOException ex) {
        requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
        exceptionCounter.increment();
        lastStatus = 0;
        lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
        lastCause = ex;
        continue;
      }
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);

      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        successCounter.increment();
        return new Exchange(status, response.body(), attempt);
      }
      if (retryPolicy.isRetryableStatus(status)) {
        retryableCounter.increment();
        lastStatus = status;
        lastError = "HTTP " + status;
        lastCause = null;
        continue;
      }
      fatalCounter.increment();
      throw fatal(window, status, response.body());
    }

    throw new WindowFetchFailedException(window, attempt, lastStatus, lastError, lastCause);
  }

  private JsonNode parseEnvelope(Exchange exchange, TimeWindow window) {
    JsonNode root;
    try {
      root = objectMapper.readTree(exchange.body());
    } catch (JsonProcessingException ex) {
      malformedCounter.increment();
      throw new MalformedResponseException(window, "body is not JSON", ex);
    }
    if (root == null || !root.isObject()) {
      malformedCounter.increment();
      throw new MalformedResponseException(window, "body is not a JSON object");
    }
    if ("error".equals(root.path("status").asText())) {
      fatalCounter.increment();
      throw new FatalBackendException(
          window,
          exchange.statusCode(),
          root.path("errorType").asText("unknown"),
          root.path("error").asText(""));
    }
    return root;
  }

  private void requireResultArray(JsonNode root, TimeWindow window) {
    if (!root.path("data").path("result").isArray()) {
      malformedCounter.increment();
      throw new MalformedResponseException(window, "missing data.result array");
    }
  }

  private FatalBackendException fatal(TimeWindow window, int status, String body) {
    String errorType = "http_" + status;
    String message = body == null ? "" : body;
    try {
      JsonNode root = objectMapper.readTree(body == null ? "" : body);
      if (root != null && root.isObject()) {
        errorType = root.path("errorType").asText(errorType);
        message = root.path("error").asText(message);
      }
    } catch (JsonProcessingException ex) {
      log.debug("Prometheus error body is not JSON (status {})", status);
    }
    log.error("Prometheus rejected query (status {}, errorType {}): {}", status, errorType, message);
    return new FatalBackendException(window, status, errorType, message);
  }

  private void sleep(Duration backoff) {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AcquisitionCancelledException("acquisition interrupted during retry backoff", false, ex);
    }
  }

  private Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("acquisition.prometheus.http.requests.total")
        .description("Prometheus query HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private String baseUrl() {
    String value = properties.getPrometheus().getBaseUrl();
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Prometheus base URL is missing.");
    }
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == '/') {
      end--;
    }
    return value.substring(0, end);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private record Exchange(int statusCode, String body, int attempts) {}
}
