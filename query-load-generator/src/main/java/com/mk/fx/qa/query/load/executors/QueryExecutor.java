package com.mk.fx.qa.query.load.executors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.RateLimiter;
import com.mk.fx.qa.query.load.backend.SearchRequest;
import com.mk.fx.qa.query.load.backend.SearchResponse;
import com.mk.fx.qa.query.load.metrics.ErrorTracker;
import com.mk.fx.qa.query.load.metrics.ExecutorStats;
import com.mk.fx.qa.query.load.model.DispatchOutcome;
import com.mk.fx.qa.query.load.model.IneligibleBucketPolicy;
import com.mk.fx.qa.query.load.model.QueryTemplate;
import com.mk.fx.qa.query.load.model.TimeBucket;
import com.mk.fx.qa.query.load.model.TimeWindow;
import com.mk.fx.qa.query.load.plan.PlanCycler;
import com.mk.fx.qa.query.load.plan.PlanSlot;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one query template: a fixed pool of workers sharing a single rate limiter and a single
 * plan cursor. Each worker waits for a permit, takes the next plan slot, resolves its time window
 * and issues exactly one search. Failures are recorded and the loop carries on; only {@link
 * #stop(Duration)} ends it.
 */
@Slf4j
public class QueryExecutor {

  /** Longest single wait on the rate limiter before the running flag is checked again. */
  private static final Duration PERMIT_POLL = Duration.ofMillis(100);

  private final QueryTemplate template;
  private final QueryExecutorParameters parameters;
  private final PlanCycler cycler;
  private final DispatchContext context;
  private final ExecutorStats stats;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile RateLimiter rateLimiter;
  private volatile Instant testStart;
  private ExecutorService workers;

  public QueryExecutor(
      QueryTemplate template,
      QueryExecutorParameters parameters,
      PlanCycler cycler,
      DispatchContext context) {
    this.template = Objects.requireNonNull(template, "template");
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.cycler = Objects.requireNonNull(cycler, "cycler");
    this.context = Objects.requireNonNull(context, "context");
    if (!template.name().equals(cycler.queryName())) {
      throw new IllegalArgumentException(
          "Plan cycler for " + cycler.queryName() + " cannot drive query " + template.name());
    }
    this.stats = new ExecutorStats(template.name(), parameters.targetRate(), context.clock());
  }

  /**
   * Launches the workers. Eligibility of every bucket is measured from {@code testStart}.
   *
   * @throws IllegalStateException if the executor was already started
   */
  public synchronized void start(Instant testStart) {
    if (workers != null) {
      throw new IllegalStateException("Query executor " + template.name() + " already started");
    }
    this.testStart = Objects.requireNonNull(testStart, "testStart");
    this.rateLimiter = RateLimiter.create(parameters.targetRate());
    stats.markStarted(context.clock().instant());
    running.set(true);

    AtomicInteger threadIndex = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("query-worker-" + template.name() + "-" + threadIndex.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    workers = Executors.newFixedThreadPool(parameters.concurrency(), threadFactory);

    for (int i = 1; i <= parameters.concurrency(); i++) {
      int workerId = i;
      Duration initialDelay = drawStagger();
      workers.execute(() -> runWorker(workerId, initialDelay));
    }
    log.info(
        "Started query executor '{}': workers={}, targetQps={}, plan entries={}, policy={}",
        template.name(),
        parameters.concurrency(),
        String.format("%.2f", parameters.targetRate()),
        cycler.size(),
        parameters.ineligiblePolicy());
  }

  /**
   * Stops all workers. Both the rate-limiter wait and any outstanding request are interrupted.
   * Calling it on an executor that is not running does nothing.
   */
  public synchronized void stop(Duration timeout) {
    if (!running.getAndSet(false) || workers == null) {
      return;
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Query executor '{}' workers did not stop within {}", template.name(), timeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping query executor '{}'", template.name());
    }
    log.info("Stopped query executor '{}'", template.name());
  }

  public boolean isRunning() {
    return running.get();
  }

  public ExecutorStats stats() {
    return stats;
  }

  public QueryTemplate template() {
    return template;
  }

  public QueryExecutorParameters parameters() {
    return parameters;
  }

  private void runWorker(int workerId, Duration initialDelay) {
    log.debug("[worker-{}] query '{}' starting after {}", workerId, template.name(), initialDelay);
    try {
      TimeUnit.NANOSECONDS.sleep(initialDelay.toNanos());
      while (awaitPermit()) {
        try {
          dispatchOnce(workerId, testStart);
        } catch (RuntimeException e) {
          log.error(
              "[worker-{}] query '{}' unexpected dispatch error: {}",
              workerId,
              template.name(),
              e.getMessage(),
              e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.debug("[worker-{}] query '{}' stopped", workerId, template.name());
  }

  /**
   * Waits for one rate-limiter permit in short slices so that shutdown is noticed promptly. Permits
   * stored while no worker was asking (startup stagger, every worker stuck on a slow search) are
   * discarded once one is held, so the limiter never releases more than one dispatch at a time.
   *
   * @return true once a permit is held, false when the executor is stopping
   */
  private boolean awaitPermit() throws InterruptedException {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      if (rateLimiter.tryAcquire(PERMIT_POLL)) {
        int discarded = discardStoredPermits(rateLimiter);
        if (discarded > 0) {
          log.debug("Query '{}' discarded {} idle permits", template.name(), discarded);
        }
        return running.get() && !Thread.currentThread().isInterrupted();
      }
      TimeUnit.MILLISECONDS.sleep(PERMIT_POLL.toMillis());
    }
    return false;
  }

  /**
   * Drains permits that can be taken without waiting. Guava's limiter banks up to one second of
   * unused permits; right after an acquire, an immediately available permit can only be a banked
   * one. While workers are queued the next permit is always in the future and nothing is drained.
   *
   * @return the number of permits drained
   */
  @VisibleForTesting
  static int discardStoredPermits(RateLimiter limiter) {
    int bound = (int) Math.ceil(limiter.getRate()) + 1;
    int discarded = 0;
    while (discarded < bound && limiter.tryAcquire()) {
      discarded++;
    }
    return discarded;
  }

  /**
   * Performs a single dispatch: next plan slot, eligibility check, window resolution, one search,
   * one recorded outcome.
   *
   * @return the outcome, or empty when the slot was skipped or the search was cut short by
   *     shutdown
   */
  @VisibleForTesting
  Optional<DispatchOutcome> dispatchOnce(int workerId, Instant testStart) {
    PlanSlot slot = cycler.next();
    Instant now = context.clock().instant();
    Duration elapsed = Duration.between(testStart, now);

    String bucketLabel = slot.entry().bucketName();
    TimeWindow window = null;
    Optional<TimeBucket> bucket = context.registry().find(bucketLabel);
    if (bucket.isPresent()) {
      if (context.registry().isEligible(bucket.get(), elapsed)) {
        window = context.registry().resolveWindow(bucket.get(), now);
      } else if (parameters.ineligiblePolicy() == IneligibleBucketPolicy.SKIP) {
        log.debug(
            "[worker-{}] bucket '{}' not eligible yet (elapsed {}), skipping slot {}",
            workerId,
            bucketLabel,
            elapsed,
            slot.sequence());
        stats.recordSkipped();
        context.metrics().recordSkipped(template.name(), bucketLabel);
        return Optional.empty();
      } else {
        log.debug(
            "[worker-{}] bucket '{}' not eligible yet (elapsed {}), using {}",
            workerId,
            bucketLabel,
            elapsed,
            TimeBucket.IMMEDIATE);
        bucketLabel = TimeBucket.IMMEDIATE;
      }
    }

    var request = new SearchRequest(template.queryExpression(), window, parameters.resultLimit());
    DispatchOutcome outcome = execute(workerId, bucketLabel, request);
    if (outcome == null) {
      return Optional.empty();
    }
    stats.record(outcome);
    context.metrics().record(outcome);
    return Optional.of(outcome);
  }

  private DispatchOutcome execute(int workerId, String bucketLabel, SearchRequest request) {
    SearchResponse response;
    try {
      response = context.client().search(request);
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) {
        log.debug("[worker-{}] query '{}' interrupted in flight", workerId, template.name());
        return null;
      }
      String category = ErrorTracker.classify(e);
      log.warn(
          "[worker-{}] [{}] error making request for query '{}' ({}): {}\n{}",
          workerId,
          bucketLabel,
          template.name(),
          category,
          e.getMessage(),
          context.client().describe(request));
      return DispatchOutcome.transportFailure(template.name(), bucketLabel, category);
    }

    if (!response.isSuccessful()) {
      log.warn(
          "[worker-{}] [{}] query '{}' failed with status {}\n{}Response body:\n{}",
          workerId,
          bucketLabel,
          template.name(),
          response.statusCode(),
          context.client().describe(request),
          response.body());
      return DispatchOutcome.httpFailure(
          template.name(),
          bucketLabel,
          response.latency(),
          response.statusCode(),
          ErrorTracker.httpCategory(response.statusCode()));
    }

    int spans = context.parser().countSpans(response.body());
    if (log.isDebugEnabled()) {
      log.debug(
          "[worker-{}] [{}] query '{}' ok in {} ms, {} spans{}",
          workerId,
          bucketLabel,
          template.name(),
          response.latency().toMillis(),
          spans,
          request.hasWindow()
              ? " window " + request.window().start() + " .. " + request.window().end()
              : "");
    }
    return DispatchOutcome.success(
        template.name(), bucketLabel, response.latency(), response.statusCode(), spans);
  }

  private Duration drawStagger() {
    long bound = parameters.startupStagger().toNanos();
    if (bound <= 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(ThreadLocalRandom.current().nextLong(bound));
  }
}
