package com.mk.fx.qa.query.load.model;

import java.time.Instant;

/** Resolution of the {@code start}/{@code end} parameters understood by the backend. */
public enum TimestampUnit {
  SECONDS {
    @Override
    public String format(Instant instant) {
      return Long.toString(instant.getEpochSecond());
    }
  },
  MICROSECONDS {
    @Override
    public String format(Instant instant) {
      return Long.toString(instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000);
    }
  };

  public abstract String format(Instant instant);
}
