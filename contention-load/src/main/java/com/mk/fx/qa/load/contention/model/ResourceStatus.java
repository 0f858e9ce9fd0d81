package com.mk.fx.qa.load.contention.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Lifecycle status of a resource under test, as the API spells it on the wire. */
public enum ResourceStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  CANCELLED("cancelled");

  /** Status every resource is reset to before a run. */
  public static final ResourceStatus INITIAL = PENDING;

  private final String wireValue;

  ResourceStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  public static Optional<ResourceStatus> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.wireValue.equalsIgnoreCase(value)).findFirst();
  }
}
