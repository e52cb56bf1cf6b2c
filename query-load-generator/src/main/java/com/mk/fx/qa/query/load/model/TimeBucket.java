package com.mk.fx.qa.query.load.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A named relative time window covering {@code [now - ageMax, now - ageMin]}.
 *
 * @param name unique bucket name referenced by plan entries
 * @param ageMin age of the most recent edge of the window
 * @param ageMax age of the oldest edge of the window
 */
public record TimeBucket(String name, Duration ageMin, Duration ageMax) {

  /** Pseudo-bucket name meaning "no time restriction". Always eligible, never registered. */
  public static final String IMMEDIATE = "immediate";

  public TimeBucket {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Time bucket name must not be blank");
    }
    if (IMMEDIATE.equals(name)) {
      throw new IllegalArgumentException("'" + IMMEDIATE + "' is reserved and cannot be defined as a bucket");
    }
    Objects.requireNonNull(ageMin, "ageMin");
    Objects.requireNonNull(ageMax, "ageMax");
    if (ageMin.isNegative() || ageMax.isNegative()) {
      throw new IllegalArgumentException(
          "Time bucket " + name + " has a negative age: ageMin=" + ageMin + ", ageMax=" + ageMax);
    }
    if (ageMin.compareTo(ageMax) > 0) {
      throw new IllegalArgumentException(
          "Time bucket " + name + " has ageMin " + ageMin + " greater than ageMax " + ageMax);
    }
  }

  /** True once the run has lasted long enough for the oldest edge of the window to hold data. */
  public boolean isEligible(Duration elapsedSinceStart) {
    return ageMax.compareTo(elapsedSinceStart) <= 0;
  }

  public Duration width() {
    return ageMax.minus(ageMin);
  }
}
