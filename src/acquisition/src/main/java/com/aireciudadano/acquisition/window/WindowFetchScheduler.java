package com.aireciudadano.acquisition.window;

import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Runs one task per window and collects the results in window order.
 *
 * <p>Tasks report skippable failures as values. A runtime exception thrown by a task aborts the
 * run and is rethrown as is.
 */
public interface WindowFetchScheduler {

  /**
   * @param windows windows to process
   * @param task per-window work
   * @param timeout whole-run budget, {@code null} for none
   * @return one result per window, same order as {@code windows}
   * @throws AcquisitionCancelledException on interrupt or when the budget is exhausted
   */
  <T> List<T> run(List<TimeWindow> windows, Function<TimeWindow, T> task, Duration timeout);

  FetchMode mode();
}
