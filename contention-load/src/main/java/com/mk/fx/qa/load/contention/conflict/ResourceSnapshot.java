package com.mk.fx.qa.load.contention.conflict;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** The fields of a {@code GET /{resource}/{id}} response the refresh step needs. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceSnapshot {

  @JsonProperty("id")
  private String id;

  @JsonProperty("version")
  private Long version;

  @JsonProperty("status")
  private String status;
}
