package com.mk.fx.qa.query.load.model;

import java.time.Instant;

/** Concrete {@code [start, end]} range sent with a dispatch. */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("Window start " + start + " is after end " + end);
    }
  }
}
