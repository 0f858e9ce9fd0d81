package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.mk.fx.qa.load.contention.model.TaskStatus;
import java.util.UUID;

public record TaskSubmissionResponse(UUID taskId, TaskStatus status, String message) {}
