package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.mk.fx.qa.load.contention.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

/** A finished task, kept in the bounded history. */
public record TaskHistoryEntry(
    UUID taskId,
    String taskType,
    TaskStatus status,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    String errorMessage) {}
