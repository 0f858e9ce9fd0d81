package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.mk.fx.qa.load.contention.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

public record TaskStatusResponse(
    UUID taskId,
    String taskType,
    TaskStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    String errorMessage) {}
