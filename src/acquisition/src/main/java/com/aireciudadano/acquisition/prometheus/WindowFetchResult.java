package com.aireciudadano.acquisition.prometheus;

import com.aireciudadano.acquisition.error.AcquisitionException;
import com.aireciudadano.acquisition.model.TimeWindow;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one range query: either the parsed response body or a skippable failure.
 *
 * @param window window that was queried
 * @param body parsed response envelope, {@code null} on failure
 * @param failure {@code WindowFetchFailedException} or {@code MalformedResponseException}, {@code
 *     null} on success
 * @param attempts HTTP attempts made
 */
public record WindowFetchResult(
    TimeWindow window, JsonNode body, AcquisitionException failure, int attempts) {

  public static WindowFetchResult success(TimeWindow window, JsonNode body, int attempts) {
    return new WindowFetchResult(window, body, null, attempts);
  }

  public static WindowFetchResult failed(TimeWindow window, AcquisitionException failure, int attempts) {
    return new WindowFetchResult(window, null, failure, attempts);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
