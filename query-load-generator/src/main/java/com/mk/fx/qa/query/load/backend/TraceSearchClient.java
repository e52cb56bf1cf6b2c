package com.mk.fx.qa.query.load.backend;

/** Backend query interface used by the query executors. Implementations must be thread-safe. */
public interface TraceSearchClient {

  /**
   * Issues exactly one search. Error statuses are returned, not thrown.
   *
   * @throws RuntimeException on transport failure (connection refused, timeout, interruption)
   */
  SearchResponse search(SearchRequest request);

  /** Human-readable rendering of the outgoing request, safe to log. */
  default String describe(SearchRequest request) {
    return request.toString();
  }
}
