package com.aireciudadano.acquisition.window;

import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Processes windows one after another on the calling thread.
 *
 * <p>The deadline is checked between windows; an in-flight request is bounded by the HTTP timeout.
 */
public class SequentialWindowScheduler implements WindowFetchScheduler {

  @Override
  public <T> List<T> run(List<TimeWindow> windows, Function<TimeWindow, T> task, Duration timeout) {
    long deadlineNs = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
    List<T> results = new ArrayList<>(windows.size());
    for (TimeWindow window : windows) {
      if (Thread.currentThread().isInterrupted()) {
        throw new AcquisitionCancelledException("acquisition cancelled before window " + window, false);
      }
      if (timeout != null && System.nanoTime() - deadlineNs > 0) {
        throw new AcquisitionCancelledException(
            "acquisition timed out after " + timeout + " before window " + window, true);
      }
      results.add(task.apply(window));
    }
    return results;
  }

  @Override
  public FetchMode mode() {
    return FetchMode.SEQUENTIAL;
  }
}
