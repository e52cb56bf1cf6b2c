package com.mk.fx.qa.query.load.rest;

import java.util.Map;
import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private long responseTimeMs;
  private long responseTimeNanos;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
