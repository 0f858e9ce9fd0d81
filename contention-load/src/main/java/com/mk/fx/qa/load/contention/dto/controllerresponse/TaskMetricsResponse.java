package com.mk.fx.qa.load.contention.dto.controllerresponse;

/** Aggregate outcome counts over every task this service has finished. */
public record TaskMetricsResponse(
    long totalCompleted,
    long totalFailed,
    long totalCancelled,
    double averageProcessingTimeMillis,
    double successRate,
    long totalProcessed) {}
