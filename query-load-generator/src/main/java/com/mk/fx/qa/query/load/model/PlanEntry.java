package com.mk.fx.qa.query.load.model;

/**
 * One (query, bucket) pairing of the execution plan.
 *
 * @param queryName name of a defined query template
 * @param bucketName name of a defined time bucket or {@link TimeBucket#IMMEDIATE}
 */
public record PlanEntry(String queryName, String bucketName) {

  public boolean isImmediate() {
    return TimeBucket.IMMEDIATE.equals(bucketName);
  }
}
