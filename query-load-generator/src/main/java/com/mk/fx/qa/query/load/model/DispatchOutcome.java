package com.mk.fx.qa.query.load.model;

import java.time.Duration;

/**
 * Result of a single dispatch, handed to the metrics sink and then dropped.
 *
 * @param queryName template that was executed
 * @param bucketName bucket label the dispatch ran under ({@link TimeBucket#IMMEDIATE} when no window)
 * @param latency time spent waiting for the backend, {@code null} when no response arrived
 * @param success true iff the backend answered with a 2xx status
 * @param resultCount matched result units; {@code null} on failure
 * @param statusCode HTTP status, {@code null} on transport failure
 * @param failureCategory error classification, {@code null} on success
 */
public record DispatchOutcome(
    String queryName,
    String bucketName,
    Duration latency,
    boolean success,
    Integer resultCount,
    Integer statusCode,
    String failureCategory) {

  public static DispatchOutcome success(
      String queryName, String bucketName, Duration latency, int statusCode, int resultCount) {
    return new DispatchOutcome(queryName, bucketName, latency, true, resultCount, statusCode, null);
  }

  public static DispatchOutcome httpFailure(
      String queryName, String bucketName, Duration latency, int statusCode, String category) {
    return new DispatchOutcome(queryName, bucketName, latency, false, null, statusCode, category);
  }

  public static DispatchOutcome transportFailure(
      String queryName, String bucketName, String category) {
    return new DispatchOutcome(queryName, bucketName, null, false, null, null, category);
  }

  public boolean hasResponse() {
    return latency != null;
  }
}
