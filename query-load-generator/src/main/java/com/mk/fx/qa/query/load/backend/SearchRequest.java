package com.mk.fx.qa.query.load.backend;

import com.mk.fx.qa.query.load.model.TimeWindow;

/**
 * One read-style request against the trace backend.
 *
 * @param queryExpression backend query to run
 * @param window time range to restrict the search to, {@code null} for an unbounded search
 * @param limit result-size cap
 */
public record SearchRequest(String queryExpression, TimeWindow window, int limit) {

  public boolean hasWindow() {
    return window != null;
  }
}
