package com.mk.fx.qa.load.contention.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/** Mutable lifecycle record of a submitted task. Transitions are guarded by the record's monitor. */
public class TaskRecord {

  private final LoadTask task;
  private final Instant submittedAt;
  private TaskStatus status = TaskStatus.QUEUED;
  private Instant startedAt;
  private Instant completedAt;
  private String errorMessage;

  public TaskRecord(LoadTask task, Instant submittedAt) {
    this.task = task;
    this.submittedAt = submittedAt;
  }

  public UUID getTaskId() {
    return task.getId();
  }

  public LoadTask getTask() {
    return task;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public synchronized TaskStatus getStatus() {
    return status;
  }

  public synchronized Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public synchronized Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public synchronized Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public synchronized void markProcessing(Instant at) {
    status = TaskStatus.PROCESSING;
    startedAt = at;
  }

  public synchronized void markCompleted(Instant at) {
    status = TaskStatus.COMPLETED;
    completedAt = at;
  }

  public synchronized void markErrored(Instant at, String message) {
    status = TaskStatus.ERROR;
    completedAt = at;
    errorMessage = message;
  }

  public synchronized void markCancelled(Instant at) {
    status = TaskStatus.CANCELLED;
    completedAt = at;
  }

  /** Processing time so far, or in total once the task has finished. Zero if never started. */
  public synchronized long getProcessingDurationMillis() {
    if (startedAt == null) {
      return 0L;
    }
    var end = completedAt != null ? completedAt : Instant.now();
    return Math.max(0L, Duration.between(startedAt, end).toMillis());
  }
}
