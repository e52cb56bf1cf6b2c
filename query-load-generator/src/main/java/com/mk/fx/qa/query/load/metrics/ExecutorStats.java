package com.mk.fx.qa.query.load.metrics;

import com.mk.fx.qa.query.load.model.DispatchOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process statistics for one query executor, kept next to the exported meters so a run can be
 * followed from the log alone: achieved vs expected rate, latency distribution, failure categories
 * and per-bucket dispatch counts.
 */
@Slf4j
public class ExecutorStats {

  private static final int LATENCY_SAMPLE_SIZE = 5000;

  @Getter private final String queryName;
  private final double expectedRps;
  private final Clock clock;
  private volatile Instant startedAt;

  private final AtomicLong dispatched = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicLong spansReturned = new AtomicLong();
  private final LatencyTracker latency = new LatencyTracker(LATENCY_SAMPLE_SIZE);
  private final ErrorTracker errorTracker = new ErrorTracker();
  private final Map<String, AtomicLong> bucketDispatches = new ConcurrentHashMap<>();

  public ExecutorStats(String queryName, double expectedRps, Clock clock) {
    this.queryName = Objects.requireNonNull(queryName, "queryName");
    this.expectedRps = expectedRps;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Marks the moment the workers were launched; achieved rate is measured from here. */
  public void markStarted(Instant startedAt) {
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
  }

  public void record(DispatchOutcome outcome) {
    dispatched.incrementAndGet();
    bucketDispatches.computeIfAbsent(outcome.bucketName(), k -> new AtomicLong()).incrementAndGet();
    if (outcome.hasResponse()) {
      latency.record(TimeUnit.NANOSECONDS.toMicros(outcome.latency().toNanos()));
    }
    if (outcome.success()) {
      spansReturned.addAndGet(outcome.resultCount() == null ? 0 : outcome.resultCount());
    } else {
      errorTracker.recordFailureCategory(outcome.failureCategory());
    }
  }

  public void recordSkipped() {
    skipped.incrementAndGet();
  }

  public long totalDispatched() {
    return dispatched.get();
  }

  public long totalErrors() {
    return errorTracker.totalErrors();
  }

  public StatsSnapshot snapshot() {
    Map<Integer, Long> pct = latency.percentiles(95, 99);
    Map<String, Long> buckets = new TreeMap<>();
    bucketDispatches.forEach((k, v) -> buckets.put(k, v.get()));
    return new StatsSnapshot(
        queryName,
        dispatched.get(),
        errorTracker.totalErrors(),
        skipped.get(),
        achievedRps(),
        expectedRps,
        toMillis(latency.min().orElse(null)),
        toMillis(latency.avg().orElse(null)),
        toMillis(latency.max().orElse(null)),
        toMillis(pct.get(95)),
        toMillis(pct.get(99)),
        spansReturned.get(),
        errorTracker.breakdownSnapshot(),
        buckets);
  }

  private static Double toMillis(Long micros) {
    return micros == null ? null : micros / 1000.0;
  }

  private double achievedRps() {
    Instant startedAt = this.startedAt;
    if (startedAt == null) {
      return 0.0;
    }
    double elapsedSec =
        Math.max(0.001, Duration.between(startedAt, clock.instant()).toMillis() / 1000.0);
    return (dispatched.get() + skipped.get()) / elapsedSec;
  }

  public void logSnapshot() {
    log.info(describe("snapshot", snapshot()));
  }

  public void logFinalSummary() {
    log.info(describe("summary", snapshot()));
  }

  static String describe(String kind, StatsSnapshot s) {
    var sb = new StringBuilder();
    sb.append("Query ")
        .append(s.queryName())
        .append(' ')
        .append(kind)
        .append(": dispatched=")
        .append(s.dispatched())
        .append(", rps actual/expected=")
        .append(String.format(Locale.ROOT, "%.2f", s.achievedRps()))
        .append('/')
        .append(String.format(Locale.ROOT, "%.2f", s.expectedRps()));
    if (s.latencyMinMs() != null) {
      sb.append(", lat(ms) min=").append(formatMs(s.latencyMinMs()));
      sb.append(", avg=").append(formatMs(s.latencyAvgMs()));
      sb.append(", max=").append(formatMs(s.latencyMaxMs()));
      sb.append(", p95=").append(formatMs(s.latencyP95Ms()));
      sb.append(", p99=").append(formatMs(s.latencyP99Ms()));
    }
    sb.append(", spans=").append(s.spansReturned());
    sb.append(", buckets=").append(s.bucketDispatches());
    if (s.skipped() > 0) {
      sb.append(", skipped=").append(s.skipped());
    }
    if (s.failures() > 0) {
      sb.append(", errors=").append(s.failures()).append(' ').append(s.errorBreakdown());
    }
    return sb.toString();
  }

  private static String formatMs(Double ms) {
    return ms == null ? "-" : String.format(Locale.ROOT, "%.3f", ms);
  }
}
