package com.aireciudadano.acquisition.window;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.aireciudadano.acquisition.error.AcquisitionCancelledException;
import com.aireciudadano.acquisition.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SequentialWindowSchedulerTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void runsWindowsInOrderOnCallingThread() {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(300), Duration.ofSeconds(100));
    List<String> threads = new ArrayList<>();

    List<Instant> starts = new SequentialWindowScheduler().run(
        windows,
        window -> {
          threads.add(Thread.currentThread().getName());
          return window.start();
        },
        Duration.ofSeconds(5));

    assertThat(starts).containsExactly(T0, T0.plusSeconds(100), T0.plusSeconds(200));
    assertThat(threads).containsOnly(Thread.currentThread().getName());
  }

  @Test
  void stopsIssuingWindowsOnceCallerIsInterrupted() {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(300), Duration.ofSeconds(100));
    List<TimeWindow> visited = new ArrayList<>();

    try {
      assertThrows(
          AcquisitionCancelledException.class,
          () -> new SequentialWindowScheduler().run(
              windows,
              window -> {
                visited.add(window);
                Thread.currentThread().interrupt();
                return window;
              },
              null));
    } finally {
      Thread.interrupted();
    }

    assertThat(visited).hasSize(1);
  }

  @Test
  void stopsIssuingWindowsAfterDeadline() throws Exception {
    List<TimeWindow> windows = WindowPlanner.plan(T0, T0.plusSeconds(300), Duration.ofSeconds(100));
    List<TimeWindow> visited = new ArrayList<>();

    AcquisitionCancelledException ex = assertThrows(
        AcquisitionCancelledException.class,
        () -> new SequentialWindowScheduler().run(
            windows,
            window -> {
              visited.add(window);
              sleepQuietly(50);
              return window;
            },
            Duration.ofMillis(10)));

    assertThat(ex.isTimedOut()).isTrue();
    assertThat(visited).hasSize(1);
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
