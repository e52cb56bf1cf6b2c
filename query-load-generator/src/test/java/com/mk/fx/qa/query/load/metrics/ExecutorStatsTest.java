package com.mk.fx.qa.query.load.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.query.load.MutableClock;
import com.mk.fx.qa.query.load.model.DispatchOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutorStatsTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));

  @Test
  void snapshot_aggregatesOutcomesPerBucketAndCategory() {
    var stats = new ExecutorStats("errors", 10.0, clock);
    stats.markStarted(clock.instant());
    stats.record(DispatchOutcome.success("errors", "recent", Duration.ofMillis(10), 200, 7));
    stats.record(DispatchOutcome.success("errors", "mid", Duration.ofMillis(30), 200, 3));
    stats.record(DispatchOutcome.httpFailure("errors", "mid", Duration.ofMillis(50), 500, "HTTP_5xx"));
    stats.record(DispatchOutcome.transportFailure("errors", "immediate", "CONNECTION_REFUSED"));
    stats.recordSkipped();
    clock.advance(Duration.ofSeconds(1));

    StatsSnapshot s = stats.snapshot();

    assertEquals(4, s.dispatched());
    assertEquals(2, s.failures());
    assertEquals(1, s.skipped());
    assertEquals(10, s.spansReturned());
    assertEquals(10.0, s.latencyMinMs(), 0.0001);
    assertEquals(30.0, s.latencyAvgMs(), 0.0001);
    assertEquals(50.0, s.latencyMaxMs(), 0.0001);
    assertEquals(5.0, s.achievedRps(), 0.001);
    assertEquals(Map.of("recent", 1L, "mid", 2L, "immediate", 1L), s.bucketDispatches());
    assertEquals(Map.of("HTTP_5XX", 1L, "CONNECTION_REFUSED", 1L), s.errorBreakdown());
  }

  @Test
  void describe_includesRatesAndOmitsLatencyBeforeFirstResponse() {
    var stats = new ExecutorStats("slow", 2.0, clock);
    stats.markStarted(clock.instant());
    stats.record(DispatchOutcome.transportFailure("slow", "immediate", "SOCKET_TIMEOUT"));
    clock.advance(Duration.ofSeconds(2));

    String line = ExecutorStats.describe("snapshot", stats.snapshot());

    assertTrue(line.startsWith("Query slow snapshot: dispatched=1"));
    assertTrue(line.contains("rps actual/expected=0.50/2.00"));
    assertFalse(line.contains("lat(ms)"));
    assertTrue(line.contains("errors=1 {SOCKET_TIMEOUT=1}"));
  }

  @Test
  void achievedRps_isMeasuredFromStart_notFromConstruction() {
    var stats = new ExecutorStats("late", 5.0, clock);
    clock.advance(Duration.ofSeconds(30));
    assertEquals(0.0, stats.snapshot().achievedRps());

    stats.markStarted(clock.instant());
    for (int i = 0; i < 5; i++) {
      stats.record(DispatchOutcome.success("late", "immediate", Duration.ofMillis(2), 200, 1));
    }
    clock.advance(Duration.ofSeconds(1));

    assertEquals(5.0, stats.snapshot().achievedRps(), 0.001);
  }

  @Test
  void subMillisecondLatencies_keepTheirResolution() {
    var stats = new ExecutorStats("fast", 100.0, clock);
    stats.markStarted(clock.instant());
    stats.record(DispatchOutcome.success("fast", "recent", Duration.ofNanos(250_000), 200, 0));
    stats.record(DispatchOutcome.success("fast", "recent", Duration.ofNanos(750_000), 200, 0));

    StatsSnapshot s = stats.snapshot();

    assertEquals(0.25, s.latencyMinMs(), 0.0001);
    assertEquals(0.5, s.latencyAvgMs(), 0.0001);
    assertEquals(0.75, s.latencyMaxMs(), 0.0001);
    assertEquals(0.75, s.latencyP95Ms(), 0.0001);
    assertTrue(ExecutorStats.describe("snapshot", s).contains("lat(ms) min=0.250"));
  }
}
