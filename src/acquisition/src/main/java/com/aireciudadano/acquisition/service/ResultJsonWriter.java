package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.model.AcquisitionResult;
import com.aireciudadano.acquisition.model.StationRecord;
import com.aireciudadano.acquisition.model.WindowFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Serializes an acquisition result for the presentation layer.
 *
 * <p>Rows become {@code {"date": <ISO-8601 UTC>, <metric>: <value|null>, ...}} with metric keys in
 * request order. Null values are written as explicit JSON nulls.
 */
@Component
public class ResultJsonWriter {
  private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT.withZone(ZoneOffset.UTC);

  private final ObjectMapper objectMapper;

  public ResultJsonWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ObjectNode toJson(AcquisitionResult result) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("total_records", result.totalRecords());

    ObjectNode data = root.putObject("data");
    for (Map.Entry<String, List<StationRecord>> entry : result.data().entrySet()) {
      ArrayNode rows = data.putArray(entry.getKey());
      for (StationRecord record : entry.getValue()) {
        rows.add(toRow(record, result.metrics()));
      }
    }

    ObjectNode windows = root.putObject("windows");
    windows.put("planned", result.windowsPlanned());
    windows.put("failed", result.failures().size());
    if (!result.failures().isEmpty()) {
      ArrayNode failures = windows.putArray("failures");
      for (WindowFailure failure : result.failures()) {
        ObjectNode node = failures.addObject();
        node.put("start", ISO.format(failure.window().start()));
        node.put("end", ISO.format(failure.window().end()));
        node.put("kind", failure.kind().name());
        node.put("attempts", failure.attempts());
        node.put("message", failure.message());
      }
    }
    return root;
  }

  public String write(AcquisitionResult result) {
    try {
      return objectMapper.writeValueAsString(toJson(result));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize acquisition result", ex);
    }
  }

  private ObjectNode toRow(StationRecord record, List<String> metrics) {
    ObjectNode row = objectMapper.createObjectNode();
    row.put("date", ISO.format(record.timestamp()));
    for (String metric : metrics) {
      Double value = record.values().get(metric);
      if (value == null) {
        row.putNull(metric);
      } else {
        row.put(metric, value.doubleValue());
      }
    }
    return row;
  }
}
