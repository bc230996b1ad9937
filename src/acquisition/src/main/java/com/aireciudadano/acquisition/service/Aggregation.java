package com.aireciudadano.acquisition.service;

import java.util.List;

/**
 * Per-bucket aggregate over the non-null values of one metric.
 */
public enum Aggregation {
  MEAN {
    @Override
    Double compute(List<Double> chronological) {
      double sum = 0.0;
      for (double value : chronological) {
        sum += value;
      }
      return sum / chronological.size();
    }
  },
  /** Chronologically last non-null value. */
  LAST {
    @Override
    Double compute(List<Double> chronological) {
      return chronological.get(chronological.size() - 1);
    }
  },
  MIN {
    @Override
    Double compute(List<Double> chronological) {
      double min = Double.POSITIVE_INFINITY;
      for (double value : chronological) {
        min = Math.min(min, value);
      }
      return min;
    }
  },
  MAX {
    @Override
    Double compute(List<Double> chronological) {
      double max = Double.NEGATIVE_INFINITY;
      for (double value : chronological) {
        max = Math.max(max, value);
      }
      return max;
    }
  };

  /**
   * @param chronological non-null values sorted by timestamp
   * @return aggregate, {@code null} when there is nothing to aggregate
   */
  public Double apply(List<Double> chronological) {
    if (chronological == null || chronological.isEmpty()) {
      return null;
    }
    return compute(chronological);
  }

  abstract Double compute(List<Double> chronological);
}
