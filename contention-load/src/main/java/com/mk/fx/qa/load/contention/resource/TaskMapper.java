package com.mk.fx.qa.load.contention.resource;

import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.load.contention.model.LoadTask;
import com.mk.fx.qa.load.contention.model.TaskType;
import java.time.Instant;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/** Turns a submission into a domain task with a fresh id and timestamp. */
@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class})
public interface TaskMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  @Mapping(target = "taskType", source = "taskType", qualifiedByName = "mapTaskType")
  LoadTask toDomain(TaskSubmissionRequest request);

  /**
   * @throws IllegalArgumentException for an unknown task type, reported as 400
   */
  @Named("mapTaskType")
  default TaskType mapTaskType(String taskType) {
    return TaskType.fromValue(taskType != null ? taskType.trim() : null);
  }
}
