package com.mk.fx.qa.load.contention.conflict;

import java.util.Objects;

/**
 * Retry and backoff parameters shared by every worker of a run.
 *
 * @param retryCount maximum refresh-and-resend attempts per conflict; 0 disables retries
 * @param backoffBase exponential base for the skip ceiling
 * @param backoffMax upper bound on skipped cycles
 * @param backoffPolicy fixed or full-jitter
 */
public record RetryPolicy(
    int retryCount, int backoffBase, int backoffMax, BackoffPolicy backoffPolicy) {

  public RetryPolicy {
    if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
    if (backoffBase < 1) throw new IllegalArgumentException("backoffBase must be >= 1");
    if (backoffMax < 1) throw new IllegalArgumentException("backoffMax must be >= 1");
    Objects.requireNonNull(backoffPolicy, "backoffPolicy");
  }

  public boolean retriesEnabled() {
    return retryCount > 0;
  }
}
