package com.mk.fx.qa.query.load.buckets;

import com.mk.fx.qa.query.load.model.TimeBucket;
import com.mk.fx.qa.query.load.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Read-only lookup of the configured time buckets plus the two questions asked of them on every
 * dispatch: can this bucket hold data yet, and which concrete window does it cover right now.
 *
 * <p>Window jitter is bounded by the bucket width and only ever moves the recent edge back in
 * time, so a resolved window always stays inside {@code [ageMin, ageMax]}.
 *
 * <p>Thread-safety: immutable after construction; safe to share across all workers without locking.
 */
public final class TimeBucketRegistry {

  private final Map<String, TimeBucket> buckets;
  private final double jitterFraction;

  /**
   * @param buckets bucket definitions, names must be unique
   * @param jitterFraction share of each bucket's width usable as jitter, in {@code [0, 1]}
   * @throws IllegalArgumentException on duplicate names or an out-of-range fraction
   */
  public TimeBucketRegistry(List<TimeBucket> buckets, double jitterFraction) {
    Objects.requireNonNull(buckets, "buckets");
    if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction > 1.0) {
      throw new IllegalArgumentException(
          "Window jitter fraction must be within [0, 1], got " + jitterFraction);
    }
    Map<String, TimeBucket> byName = new LinkedHashMap<>();
    for (TimeBucket bucket : buckets) {
      Objects.requireNonNull(bucket, "Time bucket entry cannot be null");
      if (byName.putIfAbsent(bucket.name(), bucket) != null) {
        throw new IllegalArgumentException("Duplicate time bucket name: " + bucket.name());
      }
    }
    this.buckets = Collections.unmodifiableMap(byName);
    this.jitterFraction = jitterFraction;
  }

  /** True for {@link TimeBucket#IMMEDIATE} and for every registered bucket. */
  public boolean isKnown(String bucketName) {
    return TimeBucket.IMMEDIATE.equals(bucketName) || buckets.containsKey(bucketName);
  }

  /**
   * Looks up a bucket by name.
   *
   * @return the bucket, or empty for {@link TimeBucket#IMMEDIATE}
   * @throws IllegalArgumentException if the name is neither registered nor "immediate"
   */
  public Optional<TimeBucket> find(String bucketName) {
    if (TimeBucket.IMMEDIATE.equals(bucketName)) {
      return Optional.empty();
    }
    TimeBucket bucket = buckets.get(bucketName);
    if (bucket == null) {
      throw new IllegalArgumentException("Unknown time bucket: " + bucketName);
    }
    return Optional.of(bucket);
  }

  public boolean isEligible(TimeBucket bucket, Duration elapsedSinceStart) {
    return bucket.isEligible(elapsedSinceStart);
  }

  /** Eligibility by name; the immediate pseudo-bucket is always eligible. */
  public boolean isEligible(String bucketName, Duration elapsedSinceStart) {
    return find(bucketName).map(b -> b.isEligible(elapsedSinceStart)).orElse(true);
  }

  /** Resolves the bucket against {@code now}, drawing a fresh jitter for this dispatch. */
  public TimeWindow resolveWindow(TimeBucket bucket, Instant now) {
    return resolveWindow(bucket, now, drawJitter(bucket));
  }

  /**
   * Resolves the bucket against {@code now} with an explicit jitter: {@code end = now - ageMin -
   * jitter}, {@code start = now - ageMax}.
   *
   * @throws IllegalArgumentException if jitter is negative or wider than the bucket
   */
  public TimeWindow resolveWindow(TimeBucket bucket, Instant now, Duration jitter) {
    if (jitter.isNegative() || jitter.compareTo(bucket.width()) > 0) {
      throw new IllegalArgumentException(
          "Jitter " + jitter + " outside [0, " + bucket.width() + "] for bucket " + bucket.name());
    }
    Instant end = now.minus(bucket.ageMin()).minus(jitter);
    Instant start = now.minus(bucket.ageMax());
    return new TimeWindow(start, end);
  }

  private Duration drawJitter(TimeBucket bucket) {
    long bound = (long) (bucket.width().toNanos() * jitterFraction);
    if (bound <= 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(ThreadLocalRandom.current().nextLong(bound));
  }

  public Collection<TimeBucket> buckets() {
    return buckets.values();
  }

  public double jitterFraction() {
    return jitterFraction;
  }
}
