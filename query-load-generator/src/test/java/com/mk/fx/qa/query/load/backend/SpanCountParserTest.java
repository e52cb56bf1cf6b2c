package com.mk.fx.qa.query.load.backend;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.query.load.cfg.ObjectMapperConfig;
import org.junit.jupiter.api.Test;

class SpanCountParserTest {

  private final SpanCountParser parser = new SpanCountParser(new ObjectMapperConfig().objectMapper());

  @Test
  void countsSpansAcrossSpanSetsAndLegacySpanSet() {
    String body =
        """
        {
          "traces": [
            {
              "traceID": "a1",
              "rootServiceName": "checkout",
              "spanSets": [
                {"spans": [{"spanID": "1"}, {"spanID": "2"}], "matched": 2},
                {"spans": [{"spanID": "3"}], "matched": 1}
              ]
            },
            {
              "traceID": "b2",
              "spanSet": {"spans": [{"spanID": "4"}, {"spanID": "5"}], "matched": 2}
            },
            {"traceID": "c3"}
          ],
          "metrics": {"inspectedTraces": 120}
        }
        """;

    assertEquals(5, parser.countSpans(body));
  }

  @Test
  void noTraces_countsZero() {
    assertEquals(0, parser.countSpans("{\"traces\":[]}"));
    assertEquals(0, parser.countSpans("{\"metrics\":{}}"));
  }

  @Test
  void malformedOrEmptyBody_countsZeroWithoutThrowing() {
    assertEquals(0, parser.countSpans("not json"));
    assertEquals(0, parser.countSpans("{\"traces\": [ {\"spanSets\": "));
    assertEquals(0, parser.countSpans(""));
    assertEquals(0, parser.countSpans(null));
  }

  @Test
  void nullEntriesAreIgnored() {
    assertEquals(
        1, parser.countSpans("{\"traces\":[null,{\"spanSets\":[null,{\"spans\":[{\"spanID\":\"x\"}]}]}]}"));
  }
}
