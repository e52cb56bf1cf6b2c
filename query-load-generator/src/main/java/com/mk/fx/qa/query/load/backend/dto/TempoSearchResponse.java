package com.mk.fx.qa.query.load.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Getter;

/**
 * Subset of the Tempo {@code /api/search} payload needed to count matched spans. Structural
 * queries return {@code spanSets}; simple ones return a single {@code spanSet} per trace.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class TempoSearchResponse {

  @JsonProperty("traces")
  private List<Trace> traces;

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Trace {

    @JsonProperty("traceID")
    private String traceId;

    @JsonProperty("spanSets")
    private List<SpanSet> spanSets;

    @JsonProperty("spanSet")
    private SpanSet spanSet;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SpanSet {

    @JsonProperty("spans")
    private List<Span> spans;

    @JsonProperty("matched")
    private Integer matched;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Span {

    @JsonProperty("spanID")
    private String spanId;
  }
}
