package com.mk.fx.qa.query.load.cfg;

import com.mk.fx.qa.query.load.model.IneligibleBucketPolicy;
import com.mk.fx.qa.query.load.model.TimestampUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Raw run configuration bound from {@code query-load.*}. Durations stay strings here and are
 * parsed once by {@link com.mk.fx.qa.query.load.scheduler.LoadDefinitionFactory}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "query-load")
public class QueryLoadCfg {

  private String namespace = "default";

  @Valid @NotNull private Tempo tempo = new Tempo();

  @Valid @NotNull private Query query = new Query();

  @Valid private List<TimeBucketDef> timeBuckets = new ArrayList<>();

  @Valid @NotEmpty private List<QueryDef> queries = new ArrayList<>();

  @Valid @NotEmpty private List<PlanEntryDef> executionPlan = new ArrayList<>();

  @Data
  public static class Tempo {

    @NotBlank private String queryEndpoint;

    private String tenantId;

    @NotBlank private String searchPath = "/api/traces/v1/{{tenantId}}/tempo/api/search";

    private String tokenPath = "/var/run/secrets/kubernetes.io/serviceaccount/token";

    private boolean insecureSkipVerify = true;

    @Positive private long connectionTimeoutMs = 5000;

    @Positive private long requestTimeoutMs = 900_000;

    @Min(1) private int resultLimit = 1000;

    @NotNull private TimestampUnit timestampUnit = TimestampUnit.SECONDS;
  }

  @Data
  public static class Query {

    @Min(1) private int concurrentQueries = 1;

    @Positive private double targetQps = 1.0;

    @NotNull
    private IneligibleBucketPolicy ineligibleBucketPolicy =
        IneligibleBucketPolicy.FALLBACK_TO_IMMEDIATE;

    private String startupStagger = "1s";

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double windowJitterFraction = 0.5;

    private String snapshotInterval = "30s";
  }

  @Data
  public static class TimeBucketDef {

    @NotBlank private String name;

    @NotBlank private String ageMin;

    @NotBlank private String ageMax;
  }

  @Data
  public static class QueryDef {

    @NotBlank private String name;

    @NotBlank private String traceql;

    /** Workers for this query; falls back to {@code query.concurrent-queries}. */
    @Min(1) private Integer concurrency;

    /** Rate for this query; falls back to an even share of {@code query.target-qps}. */
    @Positive private Double targetQps;
  }

  @Data
  public static class PlanEntryDef {

    @NotBlank private String queryName;

    @NotBlank private String bucketName;
  }
}
