package com.mk.fx.qa.load.contention.executors.closed;

/**
 * Outcome of a closed-model run.
 *
 * @param totalWorkers workers requested
 * @param completedWorkers workers that ran all their cycles
 * @param cancelled cancellation was observed
 * @param durationExpired the wall-clock bound stopped the run
 */
public record ClosedLoadResult(
    int totalWorkers, int completedWorkers, boolean cancelled, boolean durationExpired) {}
