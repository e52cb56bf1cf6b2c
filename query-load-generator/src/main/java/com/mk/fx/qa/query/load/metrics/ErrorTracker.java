package com.mk.fx.qa.query.load.metrics;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Classifies dispatch failures into coarse categories and counts them. */
public final class ErrorTracker {

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();

  void recordFailureCategory(String category) {
    totalErrors.incrementAndGet();
    String key =
        category == null || category.isBlank() ? "UNKNOWN" : category.toUpperCase(Locale.ROOT);
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  long totalErrors() {
    return totalErrors.get();
  }

  /** Sorted copy of the per-category counts. */
  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new TreeMap<>();
    errorBreakdown.forEach((k, v) -> map.put(k, v.get()));
    return map;
  }

  /** Category of a transport failure, taken from the innermost cause. */
  public static String classify(Throwable t) {
    if (t == null) {
      return "UNKNOWN";
    }
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "InterruptedException" -> "INTERRUPTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  /** Category of an error status, e.g. {@code HTTP_5xx}. */
  public static String httpCategory(int statusCode) {
    if (statusCode >= 500) return "HTTP_5xx";
    if (statusCode >= 400) return "HTTP_4xx";
    if (statusCode >= 300) return "HTTP_3xx";
    return "HTTP_" + statusCode;
  }
}
