package com.mk.fx.qa.load.contention.conflict;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

/**
 * How many request cycles to skip before the next refresh after a conflict. The ceiling is {@code
 * min(base ^ attempt, max)}.
 */
public enum BackoffPolicy {
  /** Skip exactly the ceiling. */
  FIXED {
    @Override
    int drawSkips(int ceiling, Random random) {
      return ceiling;
    }
  },
  /** Skip a uniformly random count in {@code [0, ceiling]}. */
  FULL_JITTER {
    @Override
    int drawSkips(int ceiling, Random random) {
      // long bound: ceiling may be Integer.MAX_VALUE
      return (int) Math.floorMod(random.nextLong(), (long) ceiling + 1);
    }
  };

  abstract int drawSkips(int ceiling, Random random);

  /** Number of cycles to skip for the given attempt. */
  public int skipTarget(int attempt, int base, int max, Random random) {
    return drawSkips(ceiling(attempt, base, max), random);
  }

  /** {@code min(base ^ attempt, max)}, saturating instead of overflowing. */
  public static int ceiling(int attempt, int base, int max) {
    long value = 1;
    for (int i = 0; i < attempt && value < max; i++) {
      value *= Math.max(1, base);
    }
    return (int) Math.min(value, max);
  }

  public static Optional<BackoffPolicy> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var normalised = value.trim().replace('-', '_');
    return Arrays.stream(values()).filter(p -> p.name().equalsIgnoreCase(normalised)).findFirst();
  }
}
