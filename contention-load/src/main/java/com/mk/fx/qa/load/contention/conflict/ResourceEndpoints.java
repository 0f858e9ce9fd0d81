package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.rest.Request;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Paths of the API under test.
 *
 * @param resourcePath collection path, e.g. {@code /tasks}
 * @param fallbackPath cheap idempotent endpoint used for placeholder cycles, e.g. {@code /health}
 */
public record ResourceEndpoints(String resourcePath, String fallbackPath) {

  public static final String DEFAULT_RESOURCE_PATH = "/tasks";
  public static final String DEFAULT_FALLBACK_PATH = "/health";

  private static final String ID_TEMPLATE = "{id}";

  public static ResourceEndpoints defaults() {
    return new ResourceEndpoints(DEFAULT_RESOURCE_PATH, DEFAULT_FALLBACK_PATH);
  }

  /** Path of one resource. The id is opaque and is sent as a single encoded path segment. */
  public String resource(String id) {
    return resourceAt(encodeSegment(id));
  }

  public String status(String id) {
    return statusAt(encodeSegment(id));
  }

  public String resourceTemplate() {
    return resourceAt(ID_TEMPLATE);
  }

  public String statusTemplate() {
    return statusAt(ID_TEMPLATE);
  }

  private String resourceAt(String segment) {
    return resourcePath + "/" + segment;
  }

  private String statusAt(String segment) {
    return resourceAt(segment) + "/status";
  }

  public Request fallbackRequest() {
    return Request.get(fallbackPath);
  }

  // URLEncoder is form encoding: a space becomes '+', which a path segment would keep literally
  private static String encodeSegment(String id) {
    return URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
