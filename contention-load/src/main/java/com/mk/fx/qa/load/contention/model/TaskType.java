package com.mk.fx.qa.load.contention.model;

import java.util.Arrays;

public enum TaskType {
  /** Field updates via {@code PUT /tasks/{id}}. */
  TASKS_UPDATE,
  /** Status transitions via {@code PATCH /tasks/{id}/status}. */
  TASKS_UPDATE_STATUS;

  public static TaskType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported task type: " + value));
  }
}
