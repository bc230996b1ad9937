package com.aireciudadano.acquisition.service;

import java.util.List;

/**
 * Rule applied when several samples share {@code (station, metric, timestamp)}.
 */
public enum DuplicateStrategy {
  /** Arithmetic mean of the colliding values; order-independent. */
  MEAN {
    @Override
    public double reconcile(List<Double> values) {
      double sum = 0.0;
      for (double value : values) {
        sum += value;
      }
      return sum / values.size();
    }
  },
  /** First value in arrival order. */
  FIRST {
    @Override
    public double reconcile(List<Double> values) {
      return values.get(0);
    }
  },
  /** Last value in arrival order. */
  LAST {
    @Override
    public double reconcile(List<Double> values) {
      return values.get(values.size() - 1);
    }
  };

  /**
   * @param values non-empty colliding values, in arrival order
   */
  public abstract double reconcile(List<Double> values);
}
