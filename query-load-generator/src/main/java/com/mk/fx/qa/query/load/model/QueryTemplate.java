package com.mk.fx.qa.query.load.model;

/**
 * A backend query to execute, opaque apart from the time range attached to each dispatch.
 *
 * @param name unique template name, used as the metric label
 * @param queryExpression backend-specific query (TraceQL for Tempo)
 */
public record QueryTemplate(String name, String queryExpression) {}
