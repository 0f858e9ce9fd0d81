package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.classify.CategoryCounts;

/**
 * Per-worker totals at the end of a run (or at any point during it).
 *
 * @param conflicts every 409 observed on an update or retry write
 * @param transportFailures requests that produced no HTTP response
 */
public record WorkerReport(
    int workerIndex,
    boolean suppressed,
    CategoryCounts categories,
    long successfulRetries,
    long exhaustedRetries,
    long conflicts,
    long transportFailures) {}
