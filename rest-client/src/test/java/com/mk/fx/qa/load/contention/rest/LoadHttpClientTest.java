package com.mk.fx.qa.load.contention.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadHttpClientTest {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastMethod = new AtomicReference<>();
  private final AtomicReference<String> lastPath = new AtomicReference<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/tasks",
        exchange -> {
          lastMethod.set(exchange.getRequestMethod());
          lastPath.set(exchange.getRequestURI().getPath());
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          int status = exchange.getRequestURI().getPath().endsWith("/conflict") ? 409 : 200;
          byte[] body = "{\"version\":3}".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  @Test
  void patchWithBody_sendsJsonAndReturnsResponse() {
    try (var client = new LoadHttpClient(baseUrl, 2, Map.of("X-Test", "1"))) {
      var response =
          client.execute(
              Request.withBody(
                  HttpMethod.PATCH, "/tasks/abc/status", Map.of("status", "pending", "version", 2)));

      assertEquals(200, response.getStatusCode());
      assertTrue(response.isSuccessful());
      assertEquals("PATCH", lastMethod.get());
      assertThat(lastBody.get()).contains("\"status\":\"pending\"").contains("\"version\":2");
      assertEquals("{\"version\":3}", response.getBody());
    }
  }

  @Test
  void conflictStatus_isReturnedNotThrown() {
    try (var client = new LoadHttpClient(baseUrl, 2, null)) {
      var response = client.execute(Request.get("/tasks/conflict"));

      assertTrue(response.isConflict());
      assertFalse(response.isSuccessful());
    }
  }

  @Test
  void unreachableHost_throwsTransportException() {
    try (var client = new LoadHttpClient("http://127.0.0.1:1", 1, 1, Map.of())) {
      assertThrows(TransportException.class, () -> client.execute(Request.get("/health")));
    }
  }

  @Test
  void encodedPathSegment_isDecodedByServer() {
    try (var client = new LoadHttpClient(baseUrl, 2, null)) {
      var response = client.execute(Request.get("/tasks/task%201"));

      assertEquals(200, response.getStatusCode());
      assertEquals("/tasks/task 1", lastPath.get());
    }
  }

  @Test
  void unencodablePath_throwsTransportException_beforeSending() {
    try (var client = new LoadHttpClient(baseUrl, 2, null)) {
      var ex =
          assertThrows(TransportException.class, () -> client.execute(Request.get("/tasks/task 1")));

      assertThat(ex.getMessage()).contains("/tasks/task 1");
      assertNull(lastMethod.get());
    }
  }

  @Test
  void blankBaseUrl_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> new LoadHttpClient("  ", 1, Map.of()));
  }

  @Test
  void tryParse_returnsEmptyForMalformedJson() {
    assertTrue(JsonUtil.tryParse("{not json", Map.class).isEmpty());
    assertTrue(JsonUtil.tryParse("", Map.class).isEmpty());
    assertEquals(3, JsonUtil.tryParse("{\"version\":3}", Map.class).orElseThrow().get("version"));
  }
}
