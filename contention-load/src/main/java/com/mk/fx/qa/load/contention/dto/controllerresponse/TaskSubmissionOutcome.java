package com.mk.fx.qa.load.contention.dto.controllerresponse;

import com.mk.fx.qa.load.contention.model.TaskStatus;
import java.util.UUID;

/** What the service did with a submission, before it is turned into an HTTP response. */
public record TaskSubmissionOutcome(UUID taskId, TaskStatus status, String message) {}
