package com.aireciudadano.acquisition.window;

import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches windows concurrently on a bounded pool and waits for all of them.
 *
 * <p>Completion order is irrelevant: results are placed back at their window index. On interrupt,
 * timeout or a fatal task failure every pending task is cancelled and nothing is returned.
 */
public class ParallelWindowScheduler implements WindowFetchScheduler {
  private static final Logger log = LoggerFactory.getLogger(ParallelWindowScheduler.class);

  private final ExecutorService executor;

  public ParallelWindowScheduler(ExecutorService executor) {
    this.executor = executor;
  }

  @Override
  public <T> List<T> run(List<TimeWindow> windows, Function<TimeWindow, T> task, Duration timeout) {
    if (windows.isEmpty()) {
      return List.of();
    }
    long deadlineNs = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();

    CompletionService<T> completion = new ExecutorCompletionService<>(executor);
    Map<Future<T>, Integer> indexByFuture = new IdentityHashMap<>();
    List<Future<T>> futures = new ArrayList<>(windows.size());
    for (int i = 0; i < windows.size(); i++) {
      TimeWindow window = windows.get(i);
      Future<T> future = completion.submit(() -> task.apply(window));
      indexByFuture.put(future, i);
      futures.add(future);
    }

    List<T> results = new ArrayList<>(Collections.nCopies(windows.size(), null));
    boolean completed = false;
    try {
      for (int done = 0; done < windows.size(); done++) {
        long remainingNs = deadlineNs == Long.MAX_VALUE ? Long.MAX_VALUE : deadlineNs - System.nanoTime();
        Future<T> next = remainingNs <= 0 ? null : completion.poll(remainingNs, TimeUnit.NANOSECONDS);
        if (next == null) {
          throw new AcquisitionCancelledException(
              "acquisition timed out after " + timeout + " with " + (windows.size() - done)
                  + " window(s) pending",
              true);
        }
        results.set(indexByFuture.get(next), next.get());
      }
      completed = true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AcquisitionCancelledException("acquisition cancelled by caller", false, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("window task failed", cause);
    } finally {
      if (!completed) {
        int cancelled = 0;
        for (Future<T> future : futures) {
          if (future.cancel(true)) {
            cancelled++;
          }
        }
        log.debug("Cancelled {} pending window task(s)", cancelled);
      }
    }

    return results;
  }

  @Override
  public FetchMode mode() {
    return FetchMode.PARALLEL;
  }
}
