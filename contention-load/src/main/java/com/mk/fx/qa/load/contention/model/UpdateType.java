package com.mk.fx.qa.load.contention.model;

import java.util.Arrays;
import java.util.Optional;

/** Shape of the body produced by the field-update variant. */
public enum UpdateType {
  PRIORITY,
  STATUS,
  DESCRIPTION,
  TITLE,
  FULL;

  public static Optional<UpdateType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var trimmed = value.trim();
    return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(trimmed)).findFirst();
  }
}
