package com.mk.fx.qa.query.load.plan;

import com.mk.fx.qa.query.load.buckets.TimeBucketRegistry;
import com.mk.fx.qa.query.load.model.PlanEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The ordered, process-wide list of plan entries, partitioned by query name.
 *
 * <p>Immutable. Per-query cursors are not kept here: every call to {@link #cyclerFor(String)}
 * returns a fresh {@link PlanCycler} that the caller owns.
 */
public final class ExecutionPlan {

  private final List<PlanEntry> entries;
  private final Map<String, List<PlanEntry>> entriesByQuery;

  public ExecutionPlan(List<PlanEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("Execution plan must contain at least one entry");
    }
    Map<String, List<PlanEntry>> partitioned = new LinkedHashMap<>();
    for (PlanEntry entry : entries) {
      Objects.requireNonNull(entry, "Execution plan entry cannot be null");
      if (entry.queryName() == null || entry.queryName().isBlank()) {
        throw new IllegalArgumentException("Execution plan entry is missing its query name");
      }
      if (entry.bucketName() == null || entry.bucketName().isBlank()) {
        throw new IllegalArgumentException(
            "Execution plan entry for query " + entry.queryName() + " is missing its bucket name");
      }
      partitioned.computeIfAbsent(entry.queryName(), k -> new ArrayList<>()).add(entry);
    }
    Map<String, List<PlanEntry>> frozen = new LinkedHashMap<>();
    partitioned.forEach((query, list) -> frozen.put(query, List.copyOf(list)));
    this.entries = List.copyOf(entries);
    this.entriesByQuery = Collections.unmodifiableMap(frozen);
  }

  /**
   * Checks the plan against the declared queries and buckets.
   *
   * @throws IllegalArgumentException if an entry names an undefined query or bucket, or a declared
   *     query has no entries
   */
  public void validate(Set<String> declaredQueries, TimeBucketRegistry registry) {
    for (PlanEntry entry : entries) {
      if (!declaredQueries.contains(entry.queryName())) {
        throw new IllegalArgumentException(
            "Execution plan references undefined query: " + entry.queryName());
      }
      if (!registry.isKnown(entry.bucketName())) {
        throw new IllegalArgumentException(
            "Execution plan entry for query "
                + entry.queryName()
                + " references undefined time bucket: "
                + entry.bucketName());
      }
    }
    for (String query : declaredQueries) {
      if (!entriesByQuery.containsKey(query)) {
        throw new IllegalArgumentException("No execution plan entries for query " + query);
      }
    }
  }

  public PlanCycler cyclerFor(String queryName) {
    return new PlanCycler(queryName, entriesFor(queryName));
  }

  public List<PlanEntry> entriesFor(String queryName) {
    return entriesByQuery.getOrDefault(queryName, List.of());
  }

  /** Entry count per query name, in first-seen order. */
  public Map<String, Integer> distribution() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    entriesByQuery.forEach((query, list) -> counts.put(query, list.size()));
    return counts;
  }

  public Collection<String> queryNames() {
    return entriesByQuery.keySet();
  }

  public List<PlanEntry> entries() {
    return entries;
  }
}
