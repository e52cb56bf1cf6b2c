package com.mk.fx.qa.query.load.metrics;

import java.util.Map;

/**
 * Point-in-time view of one query executor's run statistics.
 *
 * @param queryName query template the stats belong to
 * @param dispatched dispatches that reached the backend or failed trying
 * @param failures dispatches recorded as failures
 * @param skipped plan slots dropped because their bucket was not yet eligible
 * @param achievedRps (dispatched + skipped) per second since the executor started, 0 before start
 * @param expectedRps configured target rate
 * @param latencyMinMs minimum response latency, {@code null} before the first response;
 *     latencies are milliseconds with microsecond resolution
 * @param latencyAvgMs mean response latency, {@code null} before the first response
 * @param latencyMaxMs maximum response latency, {@code null} before the first response
 * @param latencyP95Ms sampled 95th percentile, {@code null} before the first response
 * @param latencyP99Ms sampled 99th percentile, {@code null} before the first response
 * @param spansReturned total result units across successful dispatches
 * @param errorBreakdown failures per category
 * @param bucketDispatches dispatches per bucket label
 */
public record StatsSnapshot(
    String queryName,
    long dispatched,
    long failures,
    long skipped,
    double achievedRps,
    double expectedRps,
    Double latencyMinMs,
    Double latencyAvgMs,
    Double latencyMaxMs,
    Double latencyP95Ms,
    Double latencyP99Ms,
    long spansReturned,
    Map<String, Long> errorBreakdown,
    Map<String, Long> bucketDispatches) {}
