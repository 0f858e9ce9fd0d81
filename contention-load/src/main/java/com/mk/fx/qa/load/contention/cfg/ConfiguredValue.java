package com.mk.fx.qa.load.contention.cfg;

/**
 * A parsed setting and whether it came from the default rather than the input.
 *
 * @param value the effective value
 * @param defaulted true when the key was absent or its value was rejected
 */
public record ConfiguredValue<T>(T value, boolean defaulted) {

  public static <T> ConfiguredValue<T> of(T value) {
    return new ConfiguredValue<>(value, false);
  }

  public static <T> ConfiguredValue<T> defaulted(T value) {
    return new ConfiguredValue<>(value, true);
  }
}
