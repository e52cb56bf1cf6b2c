package com.mk.fx.qa.query.load.scheduler;

import com.mk.fx.qa.query.load.buckets.TimeBucketRegistry;
import com.mk.fx.qa.query.load.cfg.QueryLoadCfg;
import com.mk.fx.qa.query.load.executors.QueryExecutorParameters;
import com.mk.fx.qa.query.load.model.PlanEntry;
import com.mk.fx.qa.query.load.model.QueryTemplate;
import com.mk.fx.qa.query.load.model.TimeBucket;
import com.mk.fx.qa.query.load.plan.ExecutionPlan;
import com.mk.fx.qa.query.load.utils.LoadUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the bound configuration into a {@link LoadDefinition}. Every configuration problem is
 * raised here as an {@link IllegalArgumentException}, before any worker exists.
 */
@Slf4j
public final class LoadDefinitionFactory {

  private LoadDefinitionFactory() {
    throw new UnsupportedOperationException("LoadDefinitionFactory cannot be instantiated");
  }

  public static LoadDefinition fromConfig(QueryLoadCfg cfg) {
    Objects.requireNonNull(cfg, "cfg");
    QueryLoadCfg.Query query = Objects.requireNonNull(cfg.getQuery(), "query settings");
    QueryLoadCfg.Tempo tempo = Objects.requireNonNull(cfg.getTempo(), "tempo settings");

    TimeBucketRegistry registry =
        new TimeBucketRegistry(buildBuckets(cfg.getTimeBuckets()), query.getWindowJitterFraction());
    List<QueryTemplate> templates = buildTemplates(cfg.getQueries());

    if (cfg.getExecutionPlan() == null || cfg.getExecutionPlan().isEmpty()) {
      throw new IllegalArgumentException("Execution plan must contain at least one entry");
    }
    List<PlanEntry> entries = new ArrayList<>();
    for (QueryLoadCfg.PlanEntryDef def : cfg.getExecutionPlan()) {
      entries.add(new PlanEntry(def.getQueryName(), def.getBucketName()));
    }
    ExecutionPlan plan = new ExecutionPlan(entries);
    Set<String> declared = new LinkedHashSet<>();
    templates.forEach(t -> declared.add(t.name()));
    plan.validate(declared, registry);

    Duration stagger = duration("query.startup-stagger", query.getStartupStagger(), Duration.ZERO);
    Duration snapshotInterval =
        duration("query.snapshot-interval", query.getSnapshotInterval(), Duration.ZERO);
    if (!(query.getTargetQps() > 0)) {
      throw new IllegalArgumentException(
          "query.target-qps must be > 0, got: " + query.getTargetQps());
    }
    double evenShare = query.getTargetQps() / templates.size();

    Map<String, QueryExecutorParameters> parameters = new LinkedHashMap<>();
    for (QueryLoadCfg.QueryDef def : cfg.getQueries()) {
      int concurrency =
          def.getConcurrency() != null ? def.getConcurrency() : query.getConcurrentQueries();
      double rate = def.getTargetQps() != null ? def.getTargetQps() : evenShare;
      try {
        parameters.put(
            def.getName(),
            new QueryExecutorParameters(
                concurrency,
                rate,
                stagger,
                query.getIneligibleBucketPolicy(),
                tempo.getResultLimit()));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Query " + def.getName() + ": " + e.getMessage(), e);
      }
    }

    LoadDefinition definition =
        new LoadDefinition(templates, registry, plan, parameters, snapshotInterval);
    logSummary(cfg, definition);
    return definition;
  }

  private static List<TimeBucket> buildBuckets(List<QueryLoadCfg.TimeBucketDef> defs) {
    List<TimeBucket> buckets = new ArrayList<>();
    if (defs == null) {
      return buckets;
    }
    for (QueryLoadCfg.TimeBucketDef def : defs) {
      String name = def.getName();
      Duration ageMin = duration("time bucket " + name + " age-min", def.getAgeMin(), null);
      Duration ageMax = duration("time bucket " + name + " age-max", def.getAgeMax(), null);
      buckets.add(new TimeBucket(name, ageMin, ageMax));
    }
    return buckets;
  }

  private static List<QueryTemplate> buildTemplates(List<QueryLoadCfg.QueryDef> defs) {
    if (defs == null || defs.isEmpty()) {
      throw new IllegalArgumentException("At least one query must be defined");
    }
    Set<String> names = new LinkedHashSet<>();
    List<QueryTemplate> templates = new ArrayList<>();
    for (QueryLoadCfg.QueryDef def : defs) {
      if (def.getName() == null || def.getName().isBlank()) {
        throw new IllegalArgumentException("Query name must not be blank");
      }
      if (def.getTraceql() == null || def.getTraceql().isBlank()) {
        throw new IllegalArgumentException("Query " + def.getName() + " has no TraceQL expression");
      }
      if (!names.add(def.getName())) {
        throw new IllegalArgumentException("Duplicate query name: " + def.getName());
      }
      templates.add(new QueryTemplate(def.getName(), def.getTraceql()));
    }
    return templates;
  }

  private static Duration duration(String what, String value, Duration fallback) {
    try {
      return fallback == null
          ? LoadUtils.parseDuration(value)
          : LoadUtils.parseDuration(value, fallback);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + what + ": " + e.getMessage(), e);
    }
  }

  private static void logSummary(QueryLoadCfg cfg, LoadDefinition definition) {
    log.info(
        "Query load configuration: namespace={}, endpoint={}, tenant={}, total qps={}, policy={}",
        cfg.getNamespace(),
        cfg.getTempo().getQueryEndpoint(),
        cfg.getTempo().getTenantId(),
        String.format("%.2f", definition.totalTargetRate()),
        cfg.getQuery().getIneligibleBucketPolicy());
    for (TimeBucket bucket : definition.registry().buckets()) {
      log.info(
          "  Time bucket '{}': age {} .. {}", bucket.name(), bucket.ageMin(), bucket.ageMax());
    }
    for (QueryTemplate template : definition.templates()) {
      QueryExecutorParameters p = definition.parametersFor(template.name());
      Map<String, Integer> perBucket = new LinkedHashMap<>();
      definition
          .plan()
          .entriesFor(template.name())
          .forEach(e -> perBucket.merge(e.bucketName(), 1, Integer::sum));
      log.info(
          "  Query '{}': workers={}, qps={}, plan={}",
          template.name(),
          p.concurrency(),
          String.format("%.2f", p.targetRate()),
          perBucket);
    }
  }
}
