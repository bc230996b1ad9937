package com.aireciudadano.acquisition.service;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import com.aireciudadano.acquisition.prometheus.PrometheusQueryClient;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lists the stations known to the backend.
 */
@Service
public class StationCatalogService {
  private static final Logger log = LoggerFactory.getLogger(StationCatalogService.class);

  private final AcquisitionProperties properties;
  private final PrometheusQueryClient client;

  public StationCatalogService(AcquisitionProperties properties, PrometheusQueryClient client) {
    this.properties = properties;
    this.client = client;
  }

  /**
   * Returns the distinct values of the station label, sorted, restricted by the filter.
   *
   * @param stationFilter include/exclude patterns, null for all stations
   * @return station identifiers
   */
  public List<String> listStations(StationFilter stationFilter) {
    StationFilter filter = stationFilter == null ? StationFilter.none() : stationFilter;
    String label = properties.getLabels().getStation();
    TreeSet<String> stations = new TreeSet<>();
    for (String value : client.labelValues(label)) {
      if (value != null && !value.isBlank() && filter.matches(value)) {
        stations.add(value.trim());
      }
    }
    log.debug("Backend reports {} station(s) for label {} after filtering", stations.size(), label);
    return List.copyOf(stations);
  }
}
