package com.mk.fx.qa.load.contention.metrics;

/** How the executor stopped, recorded before the report is built. */
record CompletionInfo(
    boolean cancelled, boolean durationExpired, int totalWorkers, int completedWorkers) {}
