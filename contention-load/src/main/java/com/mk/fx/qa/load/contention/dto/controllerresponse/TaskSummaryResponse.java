package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.mk.fx.qa.load.contention.model.TaskStatus;
import java.time.Instant;
import java.util.UUID;

public record TaskSummaryResponse(
    UUID taskId, String taskType, TaskStatus status, Instant submittedAt) {}
