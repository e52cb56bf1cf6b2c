package com.mk.fx.qa.query.load.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.query.load.backend.dto.TempoSearchResponse;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives the result count of a successful search: the number of spans returned across all
 * traces. A payload that cannot be read counts as zero, it is never a dispatch failure.
 */
@Slf4j
public class SpanCountParser {

  private final ObjectMapper mapper;

  public SpanCountParser(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public int countSpans(String body) {
    if (body == null || body.isBlank()) {
      log.warn("Empty search response body, counting 0 spans");
      return 0;
    }
    TempoSearchResponse response;
    try {
      response = mapper.readValue(body, TempoSearchResponse.class);
    } catch (JsonProcessingException e) {
      log.warn("Error parsing search response JSON, counting 0 spans: {}", e.getOriginalMessage());
      return 0;
    }
    if (response == null || response.getTraces() == null) {
      return 0;
    }
    int count = 0;
    for (TempoSearchResponse.Trace trace : response.getTraces()) {
      if (trace == null) {
        continue;
      }
      if (trace.getSpanSets() != null) {
        for (TempoSearchResponse.SpanSet spanSet : trace.getSpanSets()) {
          count += spansIn(spanSet);
        }
      }
      count += spansIn(trace.getSpanSet());
    }
    return count;
  }

  private static int spansIn(TempoSearchResponse.SpanSet spanSet) {
    if (spanSet == null) {
      return 0;
    }
    List<TempoSearchResponse.Span> spans = spanSet.getSpans();
    return spans == null ? 0 : spans.size();
  }
}
