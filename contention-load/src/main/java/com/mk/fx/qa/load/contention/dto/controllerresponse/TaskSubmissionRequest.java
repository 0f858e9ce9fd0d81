package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Map;
import lombok.Data;

/** A task submission: its type and the definition payload. Id and timestamp are server-assigned. */
@Data
public class TaskSubmissionRequest {

  @JsonProperty(value = "taskId", access = JsonProperty.Access.READ_ONLY)
  private String taskId;

  @NotBlank
  @JsonProperty("taskType")
  private String taskType;

  @JsonProperty(value = "createdAt", access = JsonProperty.Access.READ_ONLY)
  private Instant createdAt;

  @NotNull
  @JsonProperty("data")
  private Map<String, Object> data;
}
