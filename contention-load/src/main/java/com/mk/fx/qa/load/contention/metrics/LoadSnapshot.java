package com.mk.fx.qa.load.contention.metrics;

/** Live view of a run for polling. Category counts are as classified so far. */
public record LoadSnapshot(
    RunConfig config,
    long completedRequests,
    long executed,
    long backoff,
    long suppressed,
    long fallback,
    long successfulRetries,
    long exhaustedRetries,
    long conflicts,
    long totalErrors,
    Double achievedRps,
    Long latencyMinMs,
    Long latencyAvgMs,
    Long latencyMaxMs) {}
