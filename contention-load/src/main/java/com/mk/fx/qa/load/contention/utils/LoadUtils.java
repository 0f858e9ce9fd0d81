package com.mk.fx.qa.load.contention.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  /** Milliseconds to whole seconds, rounded up, at least 1; null means 5 seconds. */
  public static int toSeconds(Integer millis) {
    int value = millis != null ? millis : 5000;
    return (int) Math.max(1, Math.ceil(value / 1000.0));
  }

  /**
   * Parses {@code 500ms}, {@code 30s}, {@code 5m} or {@code 1h}. Blank means zero.
   *
   * @throws IllegalArgumentException on an unknown unit or a malformed number
   */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      return Duration.ZERO;
    }
    String trimmed = value.trim().toLowerCase();
    try {
      if (trimmed.endsWith("ms")) {
        return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2)));
      }
      char unit = trimmed.charAt(trimmed.length() - 1);
      long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
      return switch (unit) {
        case 's' -> Duration.ofSeconds(amount);
        case 'm' -> Duration.ofMinutes(amount);
        case 'h' -> Duration.ofHours(amount);
        default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
      };
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed duration '" + value + "'", e);
    }
  }
}
