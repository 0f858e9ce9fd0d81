package com.mk.fx.qa.load.contention.metrics;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running min/max/sum/count plus a fixed-size uniform sample (Algorithm R) for approximate
 * percentiles. Thread-safe.
 */
final class LatencyTracker {

  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(0);
  private final AtomicLong sum = new AtomicLong();
  private final AtomicLong count = new AtomicLong();

  private final long[] sample;
  private final Random random = new Random();
  private long seen;

  LatencyTracker(int sampleCapacity) {
    if (sampleCapacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.sample = new long[sampleCapacity];
  }

  void record(long latencyMs) {
    long v = Math.max(0, latencyMs);
    count.incrementAndGet();
    sum.addAndGet(v);
    max.accumulateAndGet(v, Math::max);
    min.accumulateAndGet(v, Math::min);
    addToSample(v);
  }

  private synchronized void addToSample(long value) {
    seen++;
    if (seen <= sample.length) {
      sample[(int) seen - 1] = value;
      return;
    }
    long slot = (long) (random.nextDouble() * seen);
    if (slot < sample.length) {
      sample[(int) slot] = value;
    }
  }

  long count() {
    return count.get();
  }

  Optional<Long> minMs() {
    long v = min.get();
    return v == Long.MAX_VALUE ? Optional.empty() : Optional.of(v);
  }

  Optional<Long> maxMs() {
    return count.get() == 0 ? Optional.empty() : Optional.of(max.get());
  }

  Optional<Long> avgMs() {
    long c = count.get();
    return c == 0 ? Optional.empty() : Optional.of(sum.get() / c);
  }

  Optional<Long> p95Ms() {
    return percentile(95);
  }

  Optional<Long> p99Ms() {
    return percentile(99);
  }

  synchronized Optional<Long> percentile(int p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int filled = (int) Math.min(seen, sample.length);
    if (filled == 0) {
      return Optional.empty();
    }
    long[] sorted = Arrays.copyOf(sample, filled);
    Arrays.sort(sorted);
    int idx = Math.min(filled - 1, Math.max(0, (int) Math.ceil((p / 100.0) * filled) - 1));
    return Optional.of(sorted[idx]);
  }
}
