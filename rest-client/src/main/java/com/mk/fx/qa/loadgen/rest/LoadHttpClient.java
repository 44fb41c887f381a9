package com.mk.fx.qa.loadgen.rest;

import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client used by load workers. Wraps a {@link HttpClient} built by the caller (or a default
 * one), resolves request paths against a base URL, applies global headers and classifies
 * transport failures into {@link TransportException}. Non-2xx statuses are returned as data, not
 * thrown. This implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

  /** Default request timeout in seconds. */
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  private static final String CONTENT_TYPE = "Content-Type";

  /** Escapes everything outside the URI reserved and unreserved sets; existing escapes survive. */
  private static final Escaper URI_ESCAPER = new PercentEscaper("-._~!$&'()*+,;=:@/?%", false);

  private static final Pattern STRAY_PERCENT = Pattern.compile("%(?![0-9A-Fa-f]{2})");

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for relative request paths. */
  @Getter private final String baseUrl;

  /** Timeout duration for requests. */
  @Getter private final Duration requestTimeout;

  /**
   * Constructs a client with the default request timeout.
   *
   * @param baseUrl the base URL for relative request paths
   * @param connTimeOutSeconds connection timeout in seconds
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
    this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, headers);
  }

  /**
   * Constructs a client with a specified request timeout.
   *
   * @param baseUrl the base URL for relative request paths
   * @param connTimeOutSeconds connection timeout in seconds
   * @param requestTimeoutSeconds request timeout in seconds
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      String baseUrl, int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
    this(
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connTimeOutSeconds)).build(),
        baseUrl,
        Duration.ofSeconds(requestTimeoutSeconds),
        headers);
  }

  /**
   * Wraps an already configured {@link HttpClient}, e.g. one carrying custom TLS settings.
   *
   * @param httpClient the client to send requests with
   * @param baseUrl the base URL for relative request paths
   * @param requestTimeout per-request timeout
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      HttpClient httpClient, String baseUrl, Duration requestTimeout, Map<String, String> headers) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Base URL: {}, Request timeout: {}s, Global headers: {}",
        this.baseUrl,
        requestTimeout.toSeconds(),
        this.headers.size());
  }

  /**
   * Executes a request and buffers the response body as a string.
   *
   * @param request the request to execute
   * @return the response data, whatever the status code
   * @throws TransportException if the request could not be completed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public RestResponseData execute(Request request) throws InterruptedException {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);
    var startTime = System.nanoTime();
    try {
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, response.body(), duration);
    } catch (java.io.IOException e) {
      throw transportFailure(httpRequest, e);
    }
  }

  /**
   * Executes a request and discards the response body as it streams in, so no body is ever held
   * in memory. Used for high-rate single-request load where only status and latency matter.
   *
   * @param request the request to execute
   * @return the response data with a {@code null} body
   * @throws TransportException if the request could not be completed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public RestResponseData executeDiscardingBody(Request request) throws InterruptedException {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);
    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.discarding());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      return buildResponseData(response, null, duration);
    } catch (java.io.IOException e) {
      throw transportFailure(httpRequest, e);
    }
  }

  /**
   * Resolves a request path against the base URL; absolute URLs bypass it. Characters that
   * may not appear in a URI (spaces, braces, non-ASCII, a {@code %} not starting an escape) are
   * percent-encoded, so substituted values and unresolved placeholders are still sent.
   */
  public URI resolve(String path) {
    var p = path != null ? path : "";
    if (p.startsWith("http://") || p.startsWith("https://")) {
      int pathStart = indexOfAny(p, "/?", p.indexOf("://") + 3);
      return pathStart < 0
          ? URI.create(p)
          : URI.create(p.substring(0, pathStart) + escapeIllegalChars(p.substring(pathStart)));
    }
    if (!p.isEmpty() && !p.startsWith("/")) {
      p = "/" + p;
    }
    return URI.create(baseUrl + escapeIllegalChars(p));
  }

  private static int indexOfAny(String s, String chars, int from) {
    for (int i = from; i < s.length(); i++) {
      if (chars.indexOf(s.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }

  static String escapeIllegalChars(String raw) {
    return URI_ESCAPER.escape(STRAY_PERCENT.matcher(raw).replaceAll("%25"));
  }

  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new TransportException(
          TransportException.Kind.REQUEST, "Request method is required", null);
    }
    try {
      var requestBuilder = HttpRequest.newBuilder().uri(resolve(request.getPath())).timeout(requestTimeout);

      // global headers
      headers.forEach(requestBuilder::header);

      // request-specific headers override
      boolean hasContentType = false;
      if (request.getHeaders() != null) {
        for (var e : request.getHeaders().entrySet()) {
          requestBuilder.setHeader(e.getKey(), e.getValue());
          hasContentType |= CONTENT_TYPE.equalsIgnoreCase(e.getKey());
        }
      }
      hasContentType |= headers.keySet().stream().anyMatch(CONTENT_TYPE::equalsIgnoreCase);

      if (request.getBody() != null) {
        requestBuilder.method(
            request.getMethod().name(), HttpRequest.BodyPublishers.ofString(request.getBody()));
        if (!hasContentType) {
          requestBuilder.header(CONTENT_TYPE, "application/json");
        }
      } else {
        requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
      }
      return requestBuilder.build();
    } catch (IllegalArgumentException e) {
      throw new TransportException(
          TransportException.Kind.REQUEST, "Error building HTTP request: " + e.getMessage(), e);
    }
  }

  private TransportException transportFailure(HttpRequest httpRequest, Exception e) {
    var kind = TransportException.classify(e);
    var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    if (kind == TransportException.Kind.TIMEOUT) {
      message = "Request timed out after " + requestTimeout.toSeconds() + "s: " + message;
    }
    log.debug("{} {} failed ({}): {}", httpRequest.method(), httpRequest.uri(), kind, message);
    return new TransportException(kind, message, e);
  }

  private RestResponseData buildResponseData(HttpResponse<?> response, String body, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    Map<String, List<String>> responseHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    response.headers().map().forEach((k, v) -> responseHeaders.put(k, List.copyOf(v)));
    result.setHeaders(responseHeaders);
    result.setBody(body);
    result.setResponseTimeMs(durationMs);
    return result;
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

  @Override
  public void close() {
    // The JDK 17 HttpClient has no close(); connections are released with the client instance.
  }
}
