package com.mk.fx.qa.query.load.executors;

import com.mk.fx.qa.query.load.backend.SpanCountParser;
import com.mk.fx.qa.query.load.backend.TraceSearchClient;
import com.mk.fx.qa.query.load.buckets.TimeBucketRegistry;
import com.mk.fx.qa.query.load.metrics.QueryLoadMetrics;
import java.time.Clock;
import java.util.Objects;

/** Collaborators shared, read-only, by every query executor of a run. */
public record DispatchContext(
    TimeBucketRegistry registry,
    TraceSearchClient client,
    SpanCountParser parser,
    QueryLoadMetrics metrics,
    Clock clock) {

  public DispatchContext {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(parser, "parser");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
  }
}
