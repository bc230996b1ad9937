package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.model.Sample;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a query response into long-format samples.
 *
 * <p>Each result entry carries a label set and either a single {@code value} pair (instant
 * vector) or a {@code values} list (range matrix). Entries that cannot be attributed to a station
 * and metric are dropped; values that do not parse to a finite number are dropped.
 */
public class SampleNormalizer {
  private static final Logger log = LoggerFactory.getLogger(SampleNormalizer.class);

  private final String stationLabel;
  private final String metricLabel;

  public SampleNormalizer(String stationLabel, String metricLabel) {
    this.stationLabel = stationLabel;
    this.metricLabel = metricLabel;
  }

  /** Samples kept plus drop counts for one response. */
  public record Normalization(List<Sample> samples, int droppedEntries, int droppedValues) {}

  /**
   * @param body parsed response envelope containing {@code data.result}
   * @return samples in response order with drop counts
   */
  public Normalization normalize(JsonNode body) {
    List<Sample> samples = new ArrayList<>();
    int droppedEntries = 0;
    int droppedValues = 0;

    JsonNode result = body.path("data").path("result");
    for (JsonNode entry : result) {
      if (!entry.isObject()) {
        droppedEntries++;
        continue;
      }
      JsonNode labels = entry.path("metric");
      String station = label(labels, stationLabel);
      String metric = label(labels, metricLabel);
      if (station == null || metric == null) {
        log.debug("Dropping series without {}/{} labels: {}", stationLabel, metricLabel, labels);
        droppedEntries++;
        continue;
      }

      List<JsonNode> pairs = new ArrayList<>();
      if (entry.path("values").isArray()) {
        entry.path("values").forEach(pairs::add);
      } else if (entry.path("value").isArray()) {
        pairs.add(entry.path("value"));
      } else {
        log.warn("Dropping series {}/{} without value or values", station, metric);
        droppedEntries++;
        continue;
      }

      for (JsonNode pair : pairs) {
        Sample sample = toSample(station, metric, pair);
        if (sample == null) {
          droppedValues++;
        } else {
          samples.add(sample);
        }
      }
    }

    if (droppedEntries > 0) {
      log.warn("Dropped {} unattributable series entries", droppedEntries);
    }
    return new Normalization(samples, droppedEntries, droppedValues);
  }

  private Sample toSample(String station, String metric, JsonNode pair) {
    if (!pair.isArray() || pair.size() < 2) {
      log.warn("Dropping malformed sample pair for {}/{}: {}", station, metric, pair);
      return null;
    }
    Instant timestamp = parseTimestamp(pair.get(0));
    if (timestamp == null) {
      log.warn("Dropping sample for {}/{} with invalid timestamp: {}", station, metric, pair.get(0));
      return null;
    }
    Double value = parseValue(pair.get(1));
    if (value == null) {
      log.warn(
          "Dropping unparsable value for {}/{} at {}: {}", station, metric, timestamp, pair.get(1));
      return null;
    }
    return new Sample(station, metric, timestamp, value);
  }

  private static String label(JsonNode labels, String name) {
    JsonNode node = labels.get(name);
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  /**
   * Unix seconds, possibly fractional, kept exact to the nanosecond.
   */
  static Instant parseTimestamp(JsonNode node) {
    if (node == null || !(node.isNumber() || node.isTextual())) {
      return null;
    }
    try {
      BigDecimal seconds = new BigDecimal(node.asText().trim());
      long whole = seconds.setScale(0, RoundingMode.FLOOR).longValueExact();
      long nanos = seconds.subtract(BigDecimal.valueOf(whole))
          .movePointRight(9)
          .setScale(0, RoundingMode.HALF_UP)
          .longValueExact();
      return Instant.ofEpochSecond(whole, nanos);
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      return null;
    }
  }

  static Double parseValue(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    double value;
    if (node.isNumber()) {
      value = node.asDouble();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    } else {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }
}
