package com.mk.fx.qa.query.load.backend;

import com.mk.fx.qa.query.load.model.TimestampUnit;
import com.mk.fx.qa.query.load.rest.HttpMethod;
import com.mk.fx.qa.query.load.rest.LoadHttpClient;
import com.mk.fx.qa.query.load.rest.Request;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TraceSearchClient} for Tempo's TraceQL search API, usually reached through a
 * multi-tenant gateway. Sends {@code q}, {@code limit} and, when a window is present, {@code
 * start}/{@code end} in the configured timestamp unit.
 */
@Slf4j
public class TempoSearchClient implements TraceSearchClient {

  public static final String TENANT_VARIABLE = "tenantId";

  private final LoadHttpClient httpClient;
  private final String searchPath;
  private final TimestampUnit timestampUnit;

  public TempoSearchClient(LoadHttpClient httpClient, String searchPath, TimestampUnit timestampUnit) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
    this.timestampUnit = Objects.requireNonNull(timestampUnit, "timestampUnit");
  }

  @Override
  public SearchResponse search(SearchRequest request) {
    var response = httpClient.execute(toHttpRequest(request));
    return new SearchResponse(
        response.getStatusCode(),
        response.getBody(),
        Duration.ofNanos(response.getResponseTimeNanos()));
  }

  @Override
  public String describe(SearchRequest request) {
    return httpClient.describe(toHttpRequest(request));
  }

  Request toHttpRequest(SearchRequest request) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("q", request.queryExpression());
    if (request.hasWindow()) {
      query.put("start", timestampUnit.format(request.window().start()));
      query.put("end", timestampUnit.format(request.window().end()));
    }
    query.put("limit", Integer.toString(request.limit()));
    return Request.builder().method(HttpMethod.GET).path(searchPath).query(query).build();
  }

  /**
   * Builds the global headers for a gateway-fronted Tempo: a bearer token when one can be read
   * and the tenant header when a tenant is configured.
   */
  public static Map<String, String> gatewayHeaders(String token, String tenantId) {
    Map<String, String> headers = new LinkedHashMap<>();
    if (token != null && !token.isBlank()) {
      headers.put("Authorization", "Bearer " + token);
    }
    if (tenantId != null && !tenantId.isBlank()) {
      headers.put("X-Scope-OrgID", tenantId);
    }
    return headers;
  }

  /**
   * Reads a service account token. A missing or unreadable file only disables authentication.
   */
  public static Optional<String> readToken(String tokenPath) {
    if (tokenPath == null || tokenPath.isBlank()) {
      return Optional.empty();
    }
    try {
      String token = Files.readString(Path.of(tokenPath), StandardCharsets.UTF_8).trim();
      if (token.isEmpty()) {
        log.warn("Service account token file {} is empty, requests are sent without a token", tokenPath);
        return Optional.empty();
      }
      log.info("Service account token loaded from {}", tokenPath);
      return Optional.of(token);
    } catch (IOException e) {
      log.warn("Failed to read token from {}: {}. Requests are sent without a token", tokenPath, e.toString());
      return Optional.empty();
    }
  }
}
