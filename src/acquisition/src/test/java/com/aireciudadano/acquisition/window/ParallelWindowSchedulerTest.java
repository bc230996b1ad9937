package com.aireciudadano.acquisition.window;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.error.FatalBackendException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParallelWindowSchedulerTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void returnsResultsInWindowOrderRegardlessOfCompletionOrder() {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(400), Duration.ofSeconds(100));

    List<Instant> starts = new ParallelWindowScheduler(executor).run(
        windows,
        window -> {
          // Earlier windows finish last.
          long delay = 400 - window.start().getEpochSecond() + T0.getEpochSecond();
          sleepQuietly(delay / 4);
          return window.start();
        },
        Duration.ofSeconds(5));

    assertThat(starts).containsExactly(T0, T0.plusSeconds(100), T0.plusSeconds(200), T0.plusSeconds(300));
  }

  @Test
  void runsWindowsConcurrently() throws Exception {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(400), Duration.ofSeconds(100));
    CountDownLatch allStarted = new CountDownLatch(4);

    List<Boolean> sawAll = new ParallelWindowScheduler(executor).run(
        windows,
        window -> {
          allStarted.countDown();
          try {
            return allStarted.await(2, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
          }
        },
        Duration.ofSeconds(5));

    assertThat(sawAll).containsOnly(true);
  }

  @Test
  void timeoutCancelsPendingWindows() throws Exception {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(200), Duration.ofSeconds(100));
    CountDownLatch interrupted = new CountDownLatch(2);

    AcquisitionCancelledException ex = assertThrows(
        AcquisitionCancelledException.class,
        () -> new ParallelWindowScheduler(executor).run(
            windows,
            window -> {
              try {
                Thread.sleep(10_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
              }
              return window;
            },
            Duration.ofMillis(100)));

    assertThat(ex.isTimedOut()).isTrue();
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void fatalTaskFailureIsRethrownAsIs() {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(200), Duration.ofSeconds(100));
    AtomicInteger calls = new AtomicInteger();

    FatalBackendException ex = assertThrows(
        FatalBackendException.class,
        () -> new ParallelWindowScheduler(executor).run(
            windows,
            window -> {
              calls.incrementAndGet();
              throw new FatalBackendException(window, 400, "bad_data", "parse error");
            },
            Duration.ofSeconds(5)));

    assertThat(ex.getErrorType()).isEqualTo("bad_data");
    assertThat(calls.get()).isGreaterThanOrEqualTo(1);
  }

  @Test
  void nullTaskResultsKeepTheirWindowPosition() {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(300), Duration.ofSeconds(100));

    List<Instant> starts = new ParallelWindowScheduler(executor).run(
        windows,
        window -> window.start().equals(T0.plusSeconds(100)) ? null : window.start(),
        Duration.ofSeconds(5));

    assertThat(starts).containsExactly(T0, null, T0.plusSeconds(200));
  }

  @Test
  void emptyWindowListReturnsEmptyResult() {
    assertThat(new ParallelWindowScheduler(executor).run(List.of(), window -> window, null)).isEmpty();
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
