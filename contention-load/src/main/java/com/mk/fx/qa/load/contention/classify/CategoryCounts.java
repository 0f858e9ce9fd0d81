package com.mk.fx.qa.load.contention.classify;

/** Immutable copy of one worker's category counters. */
public record CategoryCounts(
    long executed, long backoff, long suppressed, long fallback, long requestsIssued) {

  public static final CategoryCounts ZERO = new CategoryCounts(0, 0, 0, 0, 0);

  public long sum() {
    return executed + backoff + suppressed + fallback;
  }

  public long excluded() {
    return backoff + suppressed + fallback;
  }

  public CategoryCounts plus(CategoryCounts other) {
    return new CategoryCounts(
        executed + other.executed,
        backoff + other.backoff,
        suppressed + other.suppressed,
        fallback + other.fallback,
        requestsIssued + other.requestsIssued);
  }
}
