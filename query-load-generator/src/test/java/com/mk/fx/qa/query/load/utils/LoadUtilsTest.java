package com.mk.fx.qa.query.load.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LoadUtilsTest {

  @Test
  void parsesSingleAndCompoundDurations() {
    assertEquals(Duration.ofMillis(250), LoadUtils.parseDuration("250ms"));
    assertEquals(Duration.ofSeconds(90), LoadUtils.parseDuration("90s"));
    assertEquals(Duration.ofMinutes(5), LoadUtils.parseDuration(" 5M "));
    assertEquals(Duration.ofMinutes(90), LoadUtils.parseDuration("1h30m"));
    assertEquals(Duration.ofSeconds(75).plusMillis(5), LoadUtils.parseDuration("1m15s5ms"));
    assertEquals(Duration.ZERO, LoadUtils.parseDuration("0"));
    assertEquals(Duration.ZERO, LoadUtils.parseDuration("0s"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "abc", "10", "5d", "-5s", "1h 30m", "s", "1.5s", "m5"})
  void rejectsInvalidDurations(String value) {
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration(value));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "99999999999999999h",
        "9223372036854775807m",
        "9223372036854775807s9223372036854775807s",
        "99999999999999999999ms"
      })
  void overflowingDurations_areRejectedAsInvalid(String value) {
    var ex = assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration(value));
    assertTrue(ex.getMessage().contains(value));
  }

  @Test
  void blankFallsBackWhenAFallbackIsGiven() {
    assertEquals(Duration.ofSeconds(1), LoadUtils.parseDuration(null, Duration.ofSeconds(1)));
    assertEquals(Duration.ofSeconds(1), LoadUtils.parseDuration(" ", Duration.ofSeconds(1)));
    assertEquals(Duration.ofSeconds(3), LoadUtils.parseDuration("3s", Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration(null));
  }
}
