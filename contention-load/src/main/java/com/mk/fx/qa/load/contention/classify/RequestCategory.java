package com.mk.fx.qa.load.contention.classify;

/** Mutually exclusive accounting bucket assigned to every generated request. */
public enum RequestCategory {
  /** A genuine update, refresh or retry request. The only category that feeds workload metrics. */
  EXECUTED,
  /** Placeholder issued while a backoff window is counting down. */
  BACKOFF,
  /** Placeholder issued by a worker that owns no ids. */
  SUPPRESSED,
  /** Placeholder issued when no valid request could be built this cycle. */
  FALLBACK
}
