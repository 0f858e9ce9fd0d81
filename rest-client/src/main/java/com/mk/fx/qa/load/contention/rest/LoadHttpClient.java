package com.mk.fx.qa.load.contention.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Synchronous HTTP client used by the load workers. One request is in flight per calling thread;
 * the underlying {@link HttpClient} is shared across workers.
 *
 * <p>Any HTTP status, including 4xx and 5xx, is returned as {@link RestResponseData}. Only failures
 * that produce no response at all surface as {@link TransportException}. This client never
 * retries.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

  /** Default request timeout in seconds. */
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for all requests, without a trailing slash. */
  private final String baseUrl;

  /** Timeout duration for requests. */
  private final Duration requestTimeout;

  public LoadHttpClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
    this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, headers);
  }

  /**
   * Constructs a client with a specified request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connTimeOutSeconds connection timeout in seconds
   * @param requestTimeoutSeconds request timeout in seconds
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      String baseUrl, int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connTimeOutSeconds)).build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}s, Request timeout: {}s",
        this.baseUrl,
        connTimeOutSeconds,
        requestTimeoutSeconds);
  }

  /**
   * Executes a request and waits for its response.
   *
   * @param request the request to execute
   * @return the response, whatever its status code
   * @throws TransportException if no HTTP response was received
   */
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    HttpRequest httpRequest;
    try {
      httpRequest = buildHttpRequest(request);
    } catch (IllegalArgumentException e) {
      throw new TransportException(
          "Invalid request " + request.getPath() + ": " + e.getMessage(), e);
    }
    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.trace(
          "{} {} -> {} in {} ms",
          request.getMethod(),
          httpRequest.uri(),
          response.statusCode(),
          duration);
      return buildResponseData(response, duration);
    } catch (HttpTimeoutException e) {
      throw new TransportException(
          "Request timed out after " + requestTimeout.getSeconds() + "s: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new TransportException("I/O error executing request: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted while awaiting response", e);
    }
  }

  private HttpRequest buildHttpRequest(Request request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    var path = request.getPath() != null ? request.getPath() : "";
    var builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(requestTimeout);

    headers.forEach(builder::header);
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(builder::setHeader);
    }

    if (request.getBody() != null) {
      String jsonBody;
      try {
        jsonBody = JsonUtil.toJson(request.getBody());
      } catch (JsonProcessingException e) {
        throw new TransportException("Failed to serialize request body: " + e.getMessage(), e);
      }
      builder
          .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
          .setHeader("Content-Type", "application/json");
    } else {
      builder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }
    return builder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var flattened =
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue())));
    return new RestResponseData(response.statusCode(), flattened, response.body(), durationMs);
  }

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
    // JDK 17 HttpClient has no close(); connections are released with the client instance.
  }
}
