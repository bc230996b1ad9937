package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.model.StationRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive substring filter over station identifiers.
 *
 * <p>A station passes when it contains at least one include pattern (or none are given) and no
 * exclude pattern. Exclusion wins when both match.
 */
public record StationFilter(List<String> include, List<String> exclude) {

  public StationFilter {
    include = normalize(include);
    exclude = normalize(exclude);
  }

  public static StationFilter none() {
    return new StationFilter(List.of(), List.of());
  }

  public boolean matches(String station) {
    if (station == null) {
      return false;
    }
    String candidate = station.toLowerCase(Locale.ROOT);
    for (String pattern : exclude) {
      if (candidate.contains(pattern)) {
        return false;
      }
    }
    if (include.isEmpty()) {
      return true;
    }
    for (String pattern : include) {
      if (candidate.contains(pattern)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Keeps matching rows and groups them by station.
   *
   * @param rows rows of any stations
   * @return stations in ascending order, each with its rows in chronological order
   */
  public Map<String, List<StationRecord>> filterAndGroup(Collection<? extends StationRecord> rows) {
    Map<String, List<StationRecord>> grouped = new TreeMap<>();
    for (StationRecord row : rows) {
      if (matches(row.station())) {
        grouped.computeIfAbsent(row.station(), ignored -> new ArrayList<>()).add(row);
      }
    }
    Map<String, List<StationRecord>> ordered = new LinkedHashMap<>();
    for (Map.Entry<String, List<StationRecord>> entry : grouped.entrySet()) {
      List<StationRecord> stationRows = entry.getValue();
      stationRows.sort(Comparator.comparing(StationRecord::timestamp));
      ordered.put(entry.getKey(), stationRows);
    }
    return ordered;
  }

  private static List<String> normalize(List<String> patterns) {
    List<String> normalized = new ArrayList<>();
    if (patterns == null) {
      return normalized;
    }
    for (String pattern : patterns) {
      if (pattern != null && !pattern.isBlank()) {
        normalized.add(pattern.trim().toLowerCase(Locale.ROOT));
      }
    }
    return List.copyOf(normalized);
  }
}
