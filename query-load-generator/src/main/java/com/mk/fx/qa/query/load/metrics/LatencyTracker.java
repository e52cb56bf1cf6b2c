package com.mk.fx.qa.query.load.metrics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe latency statistics: running count/min/max/sum plus a fixed-size uniform sample
 * (reservoir sampling, Algorithm R) for approximate percentiles. Values are unit-agnostic; callers
 * record microseconds so sub-millisecond responses keep their resolution.
 */
final class LatencyTracker {

  private final AtomicLong count = new AtomicLong();
  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(Long.MIN_VALUE);
  private final AtomicLong sum = new AtomicLong();

  private final long[] sample;
  private long seen;

  LatencyTracker(int sampleCapacity) {
    if (sampleCapacity <= 0) {
      throw new IllegalArgumentException("Sample capacity must be > 0");
    }
    this.sample = new long[sampleCapacity];
  }

  void record(long latency) {
    long v = Math.max(0, latency);
    count.incrementAndGet();
    sum.addAndGet(v);
    max.accumulateAndGet(v, Math::max);
    min.accumulateAndGet(v, Math::min);
    addToSample(v);
  }

  private synchronized void addToSample(long value) {
    seen++;
    if (seen <= sample.length) {
      sample[(int) seen - 1] = value;
      return;
    }
    long slot = ThreadLocalRandom.current().nextLong(seen);
    if (slot < sample.length) {
      sample[(int) slot] = value;
    }
  }

  long count() {
    return count.get();
  }

  Optional<Long> min() {
    return count.get() == 0 ? Optional.empty() : Optional.of(min.get());
  }

  Optional<Long> max() {
    return count.get() == 0 ? Optional.empty() : Optional.of(max.get());
  }

  Optional<Long> avg() {
    long c = count.get();
    return c == 0 ? Optional.empty() : Optional.of(sum.get() / c);
  }

  /**
   * Nearest-rank percentiles over the current sample, computed with a single sort.
   *
   * @return percentile to value, in the order requested; empty when nothing was recorded
   */
  synchronized Map<Integer, Long> percentiles(int... ps) {
    Map<Integer, Long> result = new LinkedHashMap<>();
    int size = (int) Math.min(seen, sample.length);
    if (size == 0) {
      return result;
    }
    long[] sorted = Arrays.copyOf(sample, size);
    Arrays.sort(sorted);
    for (int p : ps) {
      if (p < 0 || p > 100) {
        throw new IllegalArgumentException("Percentile must be between 0 and 100");
      }
      int idx = Math.min(size - 1, Math.max(0, (int) Math.ceil((p / 100.0) * size) - 1));
      result.put(p, sorted[idx]);
    }
    return result;
  }
}
