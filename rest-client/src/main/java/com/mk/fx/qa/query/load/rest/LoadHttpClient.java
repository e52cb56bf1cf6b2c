package com.mk.fx.qa.query.load.rest;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HTTP client for issuing load requests described by a {@link Request}. Resolves {@code {{var}}}
 * placeholders in paths and query values, merges global and per-request headers and applies a
 * per-request timeout. Each call is a single attempt: there is no retry logic, so the caller sees
 * the backend's real failure rate.
 *
 * <p>Instances are thread-safe and meant to be shared by every worker of a run.
 */
@Slf4j
public class LoadHttpClient {

    /** Number of token characters kept when a bearer token is rendered in logs. */
    private static final int MASKED_TOKEN_PREFIX = 20;

    private static final String AUTHORIZATION = "Authorization";

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Variables for resolving placeholders in request paths and queries. */
    private final Map<String, String> variables;

    /** Base URL for all requests. */
    private final String baseUrl;

    /** Timeout duration for requests. */
    private final Duration requestTimeout;

    /**
     * Constructs a client.
     *
     * @param baseUrl the base URL for all requests
     * @param connectTimeout connection timeout
     * @param requestTimeout upper bound on the wait for a single response
     * @param insecureSkipVerify accept any server certificate (self-signed gateways)
     * @param headers global headers to include in all requests
     * @param variables variables for resolving placeholders in paths and queries
     */
    public LoadHttpClient(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            boolean insecureSkipVerify,
            Map<String, String> headers,
            Map<String, String> variables) {

        this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");

        var builder = HttpClient.newBuilder().connectTimeout(connectTimeout);
        if (insecureSkipVerify) {
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.variables = variables != null ? Map.copyOf(variables) : Map.of();

        log.info(
                "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}, Request timeout: {}, insecureSkipVerify: {}",
                this.baseUrl,
                connectTimeout,
                requestTimeout,
                insecureSkipVerify);
    }

    /**
     * Executes a synchronous request. Any HTTP status is returned as data; only transport level
     * problems (refused connection, timeout, TLS failure) are raised.
     *
     * @param request the request to execute
     * @return the response data
     * @throws RuntimeException if the request could not be completed; if the calling thread was
     *     interrupted its interrupt flag is restored before the exception is thrown
     */
    public RestResponseData execute(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");

        var httpRequest = buildHttpRequest(request);
        try {
            var startTime = System.nanoTime();

            log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var durationNanos = System.nanoTime() - startTime;

            var result = buildResponseData(response, durationNanos);

            log.debug("Request completed in {} ms with status {}", result.getResponseTimeMs(), response.statusCode());
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Request interrupted: " + httpRequest.uri(), e);
        } catch (HttpTimeoutException e) {
            throw new RuntimeException(
                    "Request timed out after " + requestTimeout.toSeconds() + "s: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new RuntimeException("Error executing request: " + e.getMessage(), e);
        }
    }

    /**
     * Renders a request for diagnostics: method, resolved URL and merged headers, with any bearer
     * token cut down to its first characters.
     */
    public String describe(Request request) {
        var merged = new TreeMap<String, String>(headers);
        if (request.getHeaders() != null) {
            merged.putAll(request.getHeaders());
        }
        var sb = new StringBuilder();
        sb.append("Method: ").append(request.getMethod()).append('\n');
        sb.append("URL: ").append(buildUrl(request)).append('\n');
        sb.append("Headers:\n");
        merged.forEach((key, value) -> sb.append("  ")
                .append(key)
                .append(": ")
                .append(AUTHORIZATION.equalsIgnoreCase(key) ? maskToken(value) : value)
                .append('\n'));
        return sb.toString();
    }

    /**
     * Builds an HTTP request from the given Request.
     *
     * @param request the Request to build
     * @return the constructed HttpRequest
     * @throws RuntimeException if an error occurs while building the request
     */
    private HttpRequest buildHttpRequest(Request request) {
        try {
            var requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(buildUrl(request)))
                    .timeout(requestTimeout);

            // global headers
            headers.forEach(requestBuilder::header);

            // request-specific headers override
            if (request.getHeaders() != null) {
                request.getHeaders().forEach(requestBuilder::setHeader);
            }

            var method = request.getMethod() != null ? request.getMethod() : HttpMethod.GET;
            requestBuilder.method(method.name(), HttpRequest.BodyPublishers.noBody());

            return requestBuilder.build();

        } catch (RuntimeException e) {
            throw new RuntimeException("Error building HTTP request: " + e.getMessage(), e);
        }
    }

    private String buildUrl(Request request) {
        var resolvedPath = resolveVars(request.getPath(), variables);
        var url = baseUrl + (resolvedPath != null ? resolvedPath : "");
        if (request.getQuery() != null && !request.getQuery().isEmpty()) {
            url += "?" + buildQueryString(request.getQuery(), variables);
        }
        return url;
    }

    /**
     * Builds a RestResponseData object from the HTTP response.
     *
     * @param response the HTTP response
     * @param durationNanos the duration of the request in nanoseconds
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(HttpResponse<String> response, long durationNanos) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeNanos(durationNanos);
        result.setResponseTimeMs(durationNanos / 1_000_000);
        return result;
    }

    /**
     * Builds a query string from the given query parameters and variables.
     *
     * @param query the query parameters
     * @param variables the variables for resolving placeholders
     * @return the constructed query string
     */
    private String buildQueryString(Map<String, String> query, Map<String, String> variables) {
        return query.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e ->
                        encode(resolveVars(e.getKey(), variables))
                                + "="
                                + encode(resolveVars(e.getValue(), variables)))
                .collect(Collectors.joining("&"));
    }

    private String encode(String value) {
        return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
    }

    /**
     * Resolves variables in the given text using the provided variables map.
     *
     * @param text the text containing placeholders
     * @param variables the variables map
     * @return the text with placeholders replaced by variable values
     */
    private String resolveVars(String text, Map<String, String> variables) {
        if (text == null || text.isEmpty() || variables.isEmpty()) {
            return text;
        }

        var result = text;
        for (var entry : variables.entrySet()) {
            var placeholder = "{{" + entry.getKey() + "}}";
            if (result.contains(placeholder)) {
                result = result.replace(placeholder, entry.getValue());
            }
        }
        return result;
    }

    private static String maskToken(String value) {
        if (value == null || value.length() <= MASKED_TOKEN_PREFIX) {
            return value;
        }
        return value.substring(0, MASKED_TOKEN_PREFIX) + "...";
    }

    /**
     * Validates and normalizes the base URL.
     *
     * @param baseUrl the base URL to validate
     * @return the normalized base URL
     * @throws IllegalArgumentException if the base URL is null or empty
     */
    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static SSLContext trustAllContext() {
        TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            var context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {trustAll}, new SecureRandom());
            log.warn("TLS certificate verification is disabled for outgoing requests");
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialise trust-all TLS context", e);
        }
    }
}
