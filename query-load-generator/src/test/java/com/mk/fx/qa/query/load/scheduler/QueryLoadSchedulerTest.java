package com.mk.fx.qa.query.load.scheduler;

import static com.mk.fx.qa.query.load.scheduler.TestConfigs.entry;
import static com.mk.fx.qa.query.load.scheduler.TestConfigs.threeBucketConfig;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.query.load.backend.SearchRequest;
import com.mk.fx.qa.query.load.backend.SearchResponse;
import com.mk.fx.qa.query.load.backend.SpanCountParser;
import com.mk.fx.qa.query.load.backend.TraceSearchClient;
import com.mk.fx.qa.query.load.cfg.ObjectMapperConfig;
import com.mk.fx.qa.query.load.cfg.QueryLoadCfg;
import com.mk.fx.qa.query.load.executors.QueryExecutor;
import com.mk.fx.qa.query.load.metrics.QueryLoadMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryLoadSchedulerTest {

  private TraceSearchClient client;
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final QueryLoadMetrics metrics = new QueryLoadMetrics(meterRegistry, "tempo-perf");
  private final SpanCountParser parser = new SpanCountParser(new ObjectMapperConfig().objectMapper());
  private QueryLoadScheduler scheduler;

  @BeforeEach
  void setUp() {
    client = mock(TraceSearchClient.class);
    when(client.search(any(SearchRequest.class)))
        .thenReturn(new SearchResponse(200, "{\"traces\":[]}", Duration.ofMillis(2)));
  }

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.stop();
    }
  }

  @Test
  void startsOneExecutorPerQuery_andStopsThemAll() {
    QueryLoadCfg cfg = threeBucketConfig();
    cfg.getQuery().setSnapshotInterval("100ms");
    scheduler = new QueryLoadScheduler(cfg, client, parser, metrics, Clock.systemUTC());

    assertEquals(2, scheduler.executors().size());
    assertTrue(scheduler.executors().stream().noneMatch(QueryExecutor::isRunning));

    scheduler.start();

    assertNotNull(scheduler.testStart());
    assertTrue(scheduler.executors().stream().allMatch(QueryExecutor::isRunning));
    assertEquals(4, scheduler.executors().get(0).parameters().concurrency());
    await()
        .atMost(5, TimeUnit.SECONDS)
        .until(
            () -> scheduler.executors().stream().allMatch(e -> e.stats().totalDispatched() >= 3));
    verify(client, atLeastOnce()).search(any(SearchRequest.class));
    assertTrue(
        meterRegistry.get("query.load.time.bucket.queries").tag("query_name", "q2").counter().count()
            >= 3);

    scheduler.stop();

    assertTrue(scheduler.executors().stream().noneMatch(QueryExecutor::isRunning));
  }

  @Test
  void invalidConfiguration_failsBeforeAnyDispatch() {
    QueryLoadCfg cfg = threeBucketConfig();
    cfg.getExecutionPlan().add(entry("q2", "missing-bucket"));

    assertThrows(
        IllegalArgumentException.class,
        () -> new QueryLoadScheduler(cfg, client, parser, metrics, Clock.systemUTC()));
    verify(client, never()).search(any(SearchRequest.class));
  }

  @Test
  void startTwice_isRejected_andStopIsIdempotent() {
    scheduler =
        new QueryLoadScheduler(threeBucketConfig(), client, parser, metrics, Clock.systemUTC());
    scheduler.start();

    assertThrows(IllegalStateException.class, scheduler::start);

    scheduler.stop();
    assertDoesNotThrow(scheduler::stop);
  }

  @Test
  void stopBeforeStart_doesNothing() {
    scheduler =
        new QueryLoadScheduler(threeBucketConfig(), client, parser, metrics, Clock.systemUTC());
    assertDoesNotThrow(scheduler::stop);
    assertNull(scheduler.testStart());
  }
}
