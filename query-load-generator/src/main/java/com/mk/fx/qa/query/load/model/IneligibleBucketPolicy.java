package com.mk.fx.qa.query.load.model;

/** What a worker does when its plan entry names a bucket the run is too young to query. */
public enum IneligibleBucketPolicy {
  /** Dispatch anyway, without a time range, labelled {@link TimeBucket#IMMEDIATE}. */
  FALLBACK_TO_IMMEDIATE,
  /** Drop this dispatch; the rate permit is spent and the cursor still advances. */
  SKIP
}
