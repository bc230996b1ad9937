package com.aireciudadano.acquisition.error;

import com.aireciudadano.acquisition.model.WindowFailure;
import java.util.List;

/**
 * Every planned window was skipped or came back without a usable sample.
 *
 * <p>Distinct from a successful result with zero rows, which means data existed but nothing
 * matched the station filters.
 */
public class NoDataException extends AcquisitionException {
  private final int windowsPlanned;
  private final List<WindowFailure> failures;

  public NoDataException(int windowsPlanned, List<WindowFailure> failures) {
    super(
        "no data returned: " + windowsPlanned + " window(s) planned, "
            + failures.size() + " failed");
    this.windowsPlanned = windowsPlanned;
    this.failures = List.copyOf(failures);
  }

  public int getWindowsPlanned() {
    return windowsPlanned;
  }

  public List<WindowFailure> getFailures() {
    return failures;
  }
}
