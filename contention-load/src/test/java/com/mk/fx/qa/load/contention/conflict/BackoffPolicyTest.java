package com.mk.fx.qa.load.contention.conflict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void ceiling_growsExponentiallyUpToMax() {
    assertEquals(1, BackoffPolicy.ceiling(0, 2, 16));
    assertEquals(2, BackoffPolicy.ceiling(1, 2, 16));
    assertEquals(8, BackoffPolicy.ceiling(3, 2, 16));
    assertEquals(16, BackoffPolicy.ceiling(4, 2, 16));
    assertEquals(16, BackoffPolicy.ceiling(40, 2, 16));
  }

  @Test
  void ceiling_saturatesForHugeExponents() {
    assertEquals(Integer.MAX_VALUE, BackoffPolicy.ceiling(1_000, 10, Integer.MAX_VALUE));
  }

  @Test
  void fixed_skipsExactlyTheCeiling() {
    assertEquals(4, BackoffPolicy.FIXED.skipTarget(2, 2, 16, new Random()));
  }

  @Test
  void fullJitter_staysWithinZeroAndCeiling_andCoversTheRange() {
    var random = new Random(99);
    Set<Integer> seen = new HashSet<>();

    for (int i = 0; i < 500; i++) {
      int skips = BackoffPolicy.FULL_JITTER.skipTarget(2, 2, 16, random);
      assertThat(skips).isBetween(0, 4);
      seen.add(skips);
    }

    assertThat(seen).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
  }

  @Test
  void fullJitter_handlesTheLargestCeiling() {
    var random = new Random(7);

    for (int i = 0; i < 100; i++) {
      int skips = BackoffPolicy.FULL_JITTER.skipTarget(40, 10, Integer.MAX_VALUE, random);
      assertThat(skips).isBetween(0, Integer.MAX_VALUE);
    }
  }

  @Test
  void fromValue_isLenientAboutCaseAndDashes() {
    assertEquals(BackoffPolicy.FULL_JITTER, BackoffPolicy.fromValue(" full-jitter ").orElseThrow());
    assertEquals(BackoffPolicy.FIXED, BackoffPolicy.fromValue("Fixed").orElseThrow());
    assertTrue(BackoffPolicy.fromValue("linear").isEmpty());
  }

  @Test
  void retryPolicy_rejectsOutOfRangeValues() {
    assertThrows(
        IllegalArgumentException.class, () -> new RetryPolicy(-1, 2, 16, BackoffPolicy.FIXED));
    assertThrows(
        IllegalArgumentException.class, () -> new RetryPolicy(1, 2, 0, BackoffPolicy.FIXED));
    assertFalse(new RetryPolicy(0, 2, 16, BackoffPolicy.FIXED).retriesEnabled());
  }
}
