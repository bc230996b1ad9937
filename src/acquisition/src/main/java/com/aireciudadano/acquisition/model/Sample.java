package com.aireciudadano.acquisition.model;

import java.time.Instant;

/**
 * One observation in long format.
 *
 * @param station station identifier taken from the entry labels
 * @param metric metric name taken from the entry labels
 * @param timestamp UTC instant of the observation
 * @param value parsed value; {@code null} only when built by hand, the normalizer drops those
 */
public record Sample(String station, String metric, Instant timestamp, Double value) {}
