package com.mk.fx.qa.query.load.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

class ErrorTrackerTest {

  @Test
  void classify_usesRootCauseOfWrappedTransportErrors() {
    assertEquals(
        "CONNECTION_REFUSED",
        ErrorTracker.classify(new RuntimeException("wrapped", new ConnectException("refused"))));
    assertEquals("SOCKET_TIMEOUT", ErrorTracker.classify(new SocketTimeoutException("slow")));
    assertEquals("UNKNOWN_HOST", ErrorTracker.classify(new UnknownHostException("nohost")));
    assertEquals("SSL_ERROR", ErrorTracker.classify(new SSLHandshakeException("bad cert")));
    assertEquals(
        "HTTP_TIMEOUT",
        ErrorTracker.classify(new RuntimeException(new HttpTimeoutException("timed out"))));
    assertEquals(
        "INTERRUPTED", ErrorTracker.classify(new RuntimeException(new InterruptedException())));
    assertEquals("IllegalStateException", ErrorTracker.classify(new IllegalStateException()));
    assertEquals("UNKNOWN", ErrorTracker.classify(null));
  }

  @Test
  void httpCategory_groupsByStatusClass() {
    assertEquals("HTTP_5xx", ErrorTracker.httpCategory(503));
    assertEquals("HTTP_4xx", ErrorTracker.httpCategory(404));
    assertEquals("HTTP_3xx", ErrorTracker.httpCategory(302));
    assertEquals("HTTP_101", ErrorTracker.httpCategory(101));
  }

  @Test
  void recordFailureCategory_incrementsWithUppercase_andUnknownOnBlank() {
    ErrorTracker t = new ErrorTracker();
    t.recordFailureCategory("http_5xx");
    t.recordFailureCategory("");
    t.recordFailureCategory(null);
    assertEquals(3, t.totalErrors());
    var map = t.breakdownSnapshot();
    assertEquals(1L, map.get("HTTP_5XX"));
    assertEquals(2L, map.get("UNKNOWN"));
  }
}
