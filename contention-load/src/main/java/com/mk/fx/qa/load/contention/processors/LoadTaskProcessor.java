package com.mk.fx.qa.load.contention.processors;

import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.load.contention.model.TaskType;
import java.util.Set;
import java.util.UUID;

public interface LoadTaskProcessor {

  Set<TaskType> supportedTaskTypes();

  /**
   * Runs the task to completion on the calling thread.
   *
   * @throws InterruptedException if the task was cancelled
   * @throws IllegalArgumentException if the definition is structurally invalid
   */
  void execute(TaskSubmissionRequest request) throws Exception;

  void cancel(UUID taskId);
}
