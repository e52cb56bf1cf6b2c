package com.mk.fx.qa.query.load.rest;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadHttpClientTest {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<HttpExchange> lastExchange = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/api/traces/v1/tenant-a/tempo/api/search", exchange -> reply(exchange, 200, "{\"traces\":[]}"));
    server.createContext("/err", exchange -> reply(exchange, 503, "backend overloaded"));
    server.createContext("/echo", exchange -> reply(exchange, 201, "created"));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private void reply(HttpExchange exchange, int status, String body) throws IOException {
    lastExchange.set(exchange);
    lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private LoadHttpClient client(Map<String, String> headers) {
    return new LoadHttpClient(
        baseUrl,
        Duration.ofSeconds(2),
        Duration.ofSeconds(5),
        false,
        headers,
        Map.of("tenantId", "tenant-a"));
  }

  @Test
  void get_resolvesPathVariables_encodesQuery_andSendsHeaders() {
    var client = client(Map.of("X-Scope-OrgID", "tenant-a"));
    Map<String, String> query = new LinkedHashMap<>();
    query.put("q", "{ span.http.status_code >= 500 }");
    query.put("limit", "1000");
    var request =
        Request.builder()
            .method(HttpMethod.GET)
            .path("/api/traces/v1/{{tenantId}}/tempo/api/search")
            .headers(Map.of("Authorization", "Bearer abc"))
            .query(query)
            .build();

    RestResponseData response = client.execute(request);

    assertEquals(200, response.getStatusCode());
    assertTrue(response.isSuccessful());
    assertEquals("{\"traces\":[]}", response.getBody());
    assertTrue(response.getResponseTimeNanos() > 0);

    HttpExchange exchange = lastExchange.get();
    assertEquals("GET", exchange.getRequestMethod());
    assertEquals("/api/traces/v1/tenant-a/tempo/api/search", exchange.getRequestURI().getPath());
    assertEquals(
        "q=%7B+span.http.status_code+%3E%3D+500+%7D&limit=1000",
        exchange.getRequestURI().getRawQuery());
    assertEquals("tenant-a", exchange.getRequestHeaders().getFirst("X-Scope-OrgID"));
    assertEquals("Bearer abc", exchange.getRequestHeaders().getFirst("Authorization"));
  }

  @Test
  void errorStatus_isReturnedAsData_notThrown() {
    var client = client(Map.of());
    var response = client.execute(Request.builder().method(HttpMethod.GET).path("/err").build());

    assertEquals(503, response.getStatusCode());
    assertFalse(response.isSuccessful());
    assertEquals("backend overloaded", response.getBody());
  }

  @Test
  void get_sendsNoBody() {
    var client = client(Map.of());
    var response = client.execute(Request.builder().path("/echo").build());

    assertEquals(201, response.getStatusCode());
    assertEquals("GET", lastExchange.get().getRequestMethod());
    assertEquals("", lastBody.get());
    assertNull(lastExchange.get().getRequestHeaders().getFirst("Content-Type"));
  }

  @Test
  void unreachableBackend_throwsRuntimeException() {
    var client = new LoadHttpClient(
            "http://127.0.0.1:1", Duration.ofSeconds(1), Duration.ofSeconds(2), false, Map.of(), Map.of());
    var request = Request.builder().method(HttpMethod.GET).path("/anything").build();

    var ex = assertThrows(RuntimeException.class, () -> client.execute(request));
    assertNotNull(ex.getCause());
  }

  @Test
  void describe_masksBearerToken_andResolvesUrl() {
    var token = "Bearer eyJhbGciOiJSUzI1NiIsImtpZCI6IjEyMyJ9.payload.signature";
    var client = client(Map.of("Authorization", token));
    var request =
        Request.builder()
            .method(HttpMethod.GET)
            .path("/api/traces/v1/{{tenantId}}/tempo/api/search")
            .query(Map.of("q", "{}"))
            .build();

    String description = client.describe(request);

    assertTrue(description.contains("URL: " + baseUrl.substring(0, baseUrl.length() - 1)
        + "/api/traces/v1/tenant-a/tempo/api/search?q=%7B%7D"));
    assertTrue(description.contains("Authorization: " + token.substring(0, 20) + "..."));
    assertFalse(description.contains("signature"));
  }

  @Test
  void blankBaseUrl_isRejected() {
    Duration timeout = Duration.ofSeconds(1);
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadHttpClient("  ", timeout, timeout, false, null, null));
    assertThrows(
        NullPointerException.class,
        () -> new LoadHttpClient(null, timeout, timeout, false, null, null));
  }
}
