package com.mk.fx.qa.query.load.plan;

import com.mk.fx.qa.query.load.model.PlanEntry;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Infinite, repeating view over one query's slice of the execution plan.
 *
 * <p>Each call to {@link #next()} consumes exactly one cursor value with an atomic increment, so
 * concurrent workers never see the same value and never skip one. Entry {@code cursor mod size} is
 * returned; the sequence wraps around forever.
 *
 * <p>One instance is owned by one query executor and shared by its workers only.
 */
@Slf4j
public final class PlanCycler {

  private final String queryName;
  private final List<PlanEntry> entries;
  private final AtomicLong cursor = new AtomicLong();

  PlanCycler(String queryName, List<PlanEntry> entries) {
    this.queryName = Objects.requireNonNull(queryName, "queryName");
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("No execution plan entries for query " + queryName);
    }
    this.entries = List.copyOf(entries);
  }

  public PlanSlot next() {
    long sequence = cursor.getAndIncrement();
    int index = Math.floorMod(sequence, entries.size());
    if (index == 0 && sequence > 0) {
      log.info(
          "Query '{}': cycled through all {} plan entries, repeating from start (cycle: {})",
          queryName,
          entries.size(),
          sequence / entries.size());
    }
    return new PlanSlot(sequence, index, entries.get(index));
  }

  /** Number of slots handed out so far. */
  public long position() {
    return cursor.get();
  }

  public int size() {
    return entries.size();
  }

  public String queryName() {
    return queryName;
  }

  public List<PlanEntry> entries() {
    return entries;
  }
}
