package com.mk.fx.qa.query.load.plan;

import com.mk.fx.qa.query.load.model.PlanEntry;

/**
 * A plan entry handed out by a {@link PlanCycler}.
 *
 * @param sequence cursor value consumed by this dispatch, unique per query and gap-free
 * @param index position of {@code entry} inside the query's sub-plan
 * @param entry the (query, bucket) pairing to dispatch
 */
public record PlanSlot(long sequence, int index, PlanEntry entry) {}
