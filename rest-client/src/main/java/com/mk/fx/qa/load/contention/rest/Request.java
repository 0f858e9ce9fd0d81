package com.mk.fx.qa.load.contention.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A single outbound request. The body, when present, is serialised to JSON by the client. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Object body;

  public static Request get(String path) {
    return new Request(HttpMethod.GET, path, Map.of("Accept", "application/json"), null);
  }

  public static Request withBody(HttpMethod method, String path, Object body) {
    return new Request(method, path, Map.of("Content-Type", "application/json"), body);
  }
}
