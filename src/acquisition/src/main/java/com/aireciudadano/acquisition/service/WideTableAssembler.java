package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.model.Sample;
import com.aireciudadano.acquisition.model.WideRow;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pivots long-format samples into one row per {@code (station, timestamp)}.
 *
 * <p>Columns are exactly the requested metrics in request order. Missing metrics are null,
 * colliding samples are reconciled with a {@link DuplicateStrategy}, and a zero for a metric listed
 * as zero-is-missing becomes null. Samples of metrics that were not requested are ignored.
 */
public final class WideTableAssembler {
  private static final Comparator<RowKey> KEY_ORDER =
      Comparator.comparing(RowKey::station).thenComparing(RowKey::timestamp);

  private WideTableAssembler() {}

  /**
   * @param samples samples from any number of windows, in arrival order
   * @param metrics requested metric names, defines columns and their order
   * @param strategy reconciliation for duplicate {@code (station, metric, timestamp)}
   * @param zeroIsMissing metrics for which {@code 0} means "not set"
   * @return rows ordered by station then timestamp
   */
  public static List<WideRow> assemble(
      Collection<Sample> samples,
      List<String> metrics,
      DuplicateStrategy strategy,
      Set<String> zeroIsMissing) {
    Set<String> columns = new LinkedHashSet<>(metrics);
    Map<RowKey, Map<String, List<Double>>> grouped = new TreeMap<>(KEY_ORDER);

    for (Sample sample : samples) {
      if (!columns.contains(sample.metric()) || sample.value() == null) {
        continue;
      }
      grouped
          .computeIfAbsent(new RowKey(sample.station(), sample.timestamp()), ignored -> new LinkedHashMap<>())
          .computeIfAbsent(sample.metric(), ignored -> new ArrayList<>(1))
          .add(sample.value());
    }

    List<WideRow> rows = new ArrayList<>(grouped.size());
    for (Map.Entry<RowKey, Map<String, List<Double>>> entry : grouped.entrySet()) {
      Map<String, Double> values = new LinkedHashMap<>();
      for (String column : columns) {
        List<Double> colliding = entry.getValue().get(column);
        Double value = colliding == null || colliding.isEmpty() ? null : strategy.reconcile(colliding);
        if (value != null && value == 0.0 && zeroIsMissing.contains(column)) {
          value = null;
        }
        values.put(column, value);
      }
      rows.add(new WideRow(entry.getKey().station(), entry.getKey().timestamp(), values));
    }
    return rows;
  }

  private record RowKey(String station, Instant timestamp) {}
}
