package com.mk.fx.qa.query.load.metrics;

import com.mk.fx.qa.query.load.model.DispatchOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes dispatch outcomes to Micrometer. Every meter carries a {@code namespace} tag
 * identifying the load-test target.
 *
 * <p>Recording is fire-and-forget: a failure inside the meter registry is logged and swallowed so
 * it can never fail or stall a dispatch.
 */
@Slf4j
public class QueryLoadMetrics {

  static final String LATENCY = "query.load.latency";
  static final String FAILURES = "query.load.failures";
  static final String SPANS_RETURNED = "query.load.spans.returned";
  static final String BUCKET_QUERIES = "query.load.time.bucket.queries";
  static final String BUCKET_DURATION = "query.load.time.bucket.duration";
  static final String SKIPPED = "query.load.dispatch.skipped";

  /** Span counts are integral, so {@code le=0.5} holds exactly the searches that found nothing. */
  private static final double[] SPAN_COUNT_BUCKETS = {
    0.5, 1, 10, 50, 100, 250, 500, 1000, 2500, 5000
  };

  private final MeterRegistry registry;
  private final String namespace;

  public QueryLoadMetrics(MeterRegistry registry, String namespace) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.namespace = sanitize(namespace);
    log.info("Metrics initialised for namespace: {} (sanitised: {})", namespace, this.namespace);
  }

  public void record(DispatchOutcome outcome) {
    try {
      String query = outcome.queryName();
      String bucket = outcome.bucketName();

      Counter.builder(BUCKET_QUERIES)
          .description("Total queries executed per time bucket")
          .tag("namespace", namespace)
          .tag("bucket", bucket)
          .tag("query_name", query)
          .register(registry)
          .increment();

      if (outcome.hasResponse()) {
        Timer.builder(LATENCY)
            .description("Query latency")
            .tag("namespace", namespace)
            .tag("name", query)
            .publishPercentileHistogram()
            .register(registry)
            .record(outcome.latency());
        Timer.builder(BUCKET_DURATION)
            .description("Query duration per time bucket")
            .tag("namespace", namespace)
            .tag("bucket", bucket)
            .tag("query_name", query)
            .publishPercentileHistogram()
            .register(registry)
            .record(outcome.latency());
      }

      if (outcome.success()) {
        DistributionSummary.builder(SPANS_RETURNED)
            .description("Number of spans returned per query")
            .tag("namespace", namespace)
            .tag("name", query)
            .serviceLevelObjectives(SPAN_COUNT_BUCKETS)
            .register(registry)
            .record(outcome.resultCount() == null ? 0 : outcome.resultCount());
      } else {
        Counter.builder(FAILURES)
            .description("Total query failures")
            .tag("namespace", namespace)
            .tag("name", query)
            .tag("reason", outcome.failureCategory() == null ? "UNKNOWN" : outcome.failureCategory())
            .register(registry)
            .increment();
      }
    } catch (RuntimeException e) {
      log.warn("Failed to record metrics for query {}: {}", outcome.queryName(), e.getMessage());
    }
  }

  public void recordSkipped(String queryName, String bucketName) {
    try {
      Counter.builder(SKIPPED)
          .description("Dispatches dropped because their time bucket was not yet eligible")
          .tag("namespace", namespace)
          .tag("name", queryName)
          .tag("bucket", bucketName)
          .register(registry)
          .increment();
    } catch (RuntimeException e) {
      log.warn("Failed to record skipped dispatch for query {}: {}", queryName, e.getMessage());
    }
  }

  static String sanitize(String namespace) {
    if (namespace == null || namespace.isBlank()) {
      return "default";
    }
    return namespace.replace('-', '_');
  }

  public String namespace() {
    return namespace;
  }
}
