package com.mk.fx.qa.query.load.executors;

import com.mk.fx.qa.query.load.model.IneligibleBucketPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Parameters for one query executor.
 *
 * @param concurrency number of workers sharing the executor's rate limiter
 * @param targetRate aggregate requests per second across all workers
 * @param startupStagger upper bound of each worker's random initial delay
 * @param ineligiblePolicy what to do with a plan entry whose bucket cannot hold data yet
 * @param resultLimit result-size cap sent with every search
 */
public record QueryExecutorParameters(
    int concurrency,
    double targetRate,
    Duration startupStagger,
    IneligibleBucketPolicy ineligiblePolicy,
    int resultLimit) {

  public QueryExecutorParameters {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
    }
    if (!(targetRate > 0) || Double.isInfinite(targetRate)) {
      throw new IllegalArgumentException("targetQps must be > 0, got: " + targetRate);
    }
    Objects.requireNonNull(startupStagger, "startupStagger");
    if (startupStagger.isNegative()) {
      throw new IllegalArgumentException("startupStagger must not be negative: " + startupStagger);
    }
    Objects.requireNonNull(ineligiblePolicy, "ineligiblePolicy");
    if (resultLimit < 1) {
      throw new IllegalArgumentException("resultLimit must be >= 1, got: " + resultLimit);
    }
  }
}
