package com.mk.fx.qa.query.load.scheduler;

import com.mk.fx.qa.query.load.buckets.TimeBucketRegistry;
import com.mk.fx.qa.query.load.executors.QueryExecutorParameters;
import com.mk.fx.qa.query.load.model.QueryTemplate;
import com.mk.fx.qa.query.load.plan.ExecutionPlan;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable description of a run: what to query, against which windows, at which rate.
 *
 * @param templates query templates in declaration order
 * @param registry configured time buckets
 * @param plan execution plan, already checked against templates and buckets
 * @param parameters executor parameters per query name
 * @param snapshotInterval period of the stats log line, zero when disabled
 */
public record LoadDefinition(
    List<QueryTemplate> templates,
    TimeBucketRegistry registry,
    ExecutionPlan plan,
    Map<String, QueryExecutorParameters> parameters,
    Duration snapshotInterval) {

  public LoadDefinition {
    templates = List.copyOf(templates);
    parameters = Map.copyOf(parameters);
  }

  public QueryExecutorParameters parametersFor(String queryName) {
    QueryExecutorParameters p = parameters.get(queryName);
    if (p == null) {
      throw new IllegalArgumentException("No executor parameters for query " + queryName);
    }
    return p;
  }

  /** Aggregate rate across all query templates. */
  public double totalTargetRate() {
    return parameters.values().stream().mapToDouble(QueryExecutorParameters::targetRate).sum();
  }
}
