package com.mk.fx.qa.query.load.scheduler;

import com.mk.fx.qa.query.load.backend.SpanCountParser;
import com.mk.fx.qa.query.load.backend.TraceSearchClient;
import com.mk.fx.qa.query.load.cfg.QueryLoadCfg;
import com.mk.fx.qa.query.load.executors.DispatchContext;
import com.mk.fx.qa.query.load.executors.QueryExecutor;
import com.mk.fx.qa.query.load.metrics.QueryLoadMetrics;
import com.mk.fx.qa.query.load.model.QueryTemplate;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Composition root of a run. Everything is validated and built in the constructor, so a bad
 * configuration fails the application context before a single worker starts. Workers run from
 * {@link #start()} until {@link #stop()}.
 */
@Slf4j
@Component
public class QueryLoadScheduler {

  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

  private final LoadDefinition definition;
  private final Clock clock;
  private final List<QueryExecutor> executors;

  private ScheduledExecutorService snapshotScheduler;
  private Instant testStart;
  private boolean stopped;

  @Autowired
  public QueryLoadScheduler(
      QueryLoadCfg cfg,
      TraceSearchClient client,
      SpanCountParser parser,
      QueryLoadMetrics metrics,
      Clock clock) {
    this(LoadDefinitionFactory.fromConfig(cfg), client, parser, metrics, clock);
  }

  public QueryLoadScheduler(
      LoadDefinition definition,
      TraceSearchClient client,
      SpanCountParser parser,
      QueryLoadMetrics metrics,
      Clock clock) {
    this.definition = definition;
    this.clock = clock;
    var context = new DispatchContext(definition.registry(), client, parser, metrics, clock);
    List<QueryExecutor> built = new ArrayList<>();
    for (QueryTemplate template : definition.templates()) {
      built.add(
          new QueryExecutor(
              template,
              definition.parametersFor(template.name()),
              definition.plan().cyclerFor(template.name()),
              context));
    }
    this.executors = List.copyOf(built);
  }

  @PostConstruct
  public synchronized void start() {
    if (testStart != null) {
      throw new IllegalStateException("Query load already started at " + testStart);
    }
    testStart = clock.instant();
    log.info(
        "Starting query load: {} queries, {} workers in total, test start {}",
        executors.size(),
        executors.stream().mapToInt(e -> e.parameters().concurrency()).sum(),
        testStart);
    executors.forEach(executor -> executor.start(testStart));

    Duration interval = definition.snapshotInterval();
    if (!interval.isZero() && !interval.isNegative()) {
      snapshotScheduler =
          Executors.newSingleThreadScheduledExecutor(
              runnable -> {
                Thread thread = new Thread(runnable, "query-load-snapshot");
                thread.setDaemon(true);
                return thread;
              });
      snapshotScheduler.scheduleAtFixedRate(
          this::logSnapshots, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  @PreDestroy
  public synchronized void stop() {
    if (testStart == null || stopped) {
      return;
    }
    stopped = true;
    log.info("Stopping query load");
    if (snapshotScheduler != null) {
      snapshotScheduler.shutdownNow();
      snapshotScheduler = null;
    }
    executors.forEach(executor -> executor.stop(STOP_TIMEOUT));
    executors.forEach(executor -> executor.stats().logFinalSummary());
  }

  private void logSnapshots() {
    try {
      executors.forEach(executor -> executor.stats().logSnapshot());
    } catch (RuntimeException e) {
      log.warn("Failed to log query load snapshot: {}", e.getMessage());
    }
  }

  public List<QueryExecutor> executors() {
    return executors;
  }

  public LoadDefinition definition() {
    return definition;
  }

  public Instant testStart() {
    return testStart;
  }
}
