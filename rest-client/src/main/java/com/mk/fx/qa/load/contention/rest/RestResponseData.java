package com.mk.fx.qa.load.contention.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private long responseTimeMs;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isConflict() {
    return statusCode == 409;
  }
}
