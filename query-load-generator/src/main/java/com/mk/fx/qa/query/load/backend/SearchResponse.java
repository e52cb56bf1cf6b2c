package com.mk.fx.qa.query.load.backend;

import java.time.Duration;

/**
 * Raw backend answer; interpretation is left to the caller.
 *
 * @param statusCode HTTP status returned by the backend
 * @param body response payload, possibly empty
 * @param latency time from send to full response
 */
public record SearchResponse(int statusCode, String body, Duration latency) {

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
