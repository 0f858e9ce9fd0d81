package com.mk.fx.qa.load.contention.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.contention.cfg.TaskProcessingCfg;
import com.mk.fx.qa.load.contention.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionOutcome;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSummaryResponse;
import com.mk.fx.qa.load.contention.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.contention.model.LoadTask;
import com.mk.fx.qa.load.contention.model.TaskRecord;
import com.mk.fx.qa.load.contention.model.TaskStatus;
import com.mk.fx.qa.load.contention.model.TaskType;
import com.mk.fx.qa.load.contention.processors.LoadTaskProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Queues contention runs and executes them on a bounded pool, one run per pool thread. Each run
 * brings its own worker threads through the processor.
 *
 * <p>A run is routed to the {@link LoadTaskProcessor} that declares its {@link TaskType}; one
 * processor may serve several types. Finished runs stay queryable until they fall out of the
 * bounded history, at which point their record, live metrics and report are evicted together.
 */
@Slf4j
@Service
public class LoadTaskService {

  private static final Map<TaskStatus, String> SUBMISSION_MESSAGES =
      new EnumMap<>(TaskStatus.class);

  static {
    SUBMISSION_MESSAGES.put(TaskStatus.QUEUED, "Task queued");
    SUBMISSION_MESSAGES.put(TaskStatus.PROCESSING, "Task is processing");
    SUBMISSION_MESSAGES.put(TaskStatus.COMPLETED, "Task completed");
    SUBMISSION_MESSAGES.put(TaskStatus.ERROR, "Task failed");
    SUBMISSION_MESSAGES.put(TaskStatus.CANCELLED, "Task cancelled");
  }

  private final TaskProcessingCfg properties;
  private final LoadMetricsRegistry metricsRegistry;
  private final Map<TaskType, LoadTaskProcessor> processors;
  private final ThreadPoolExecutor executor;

  private final Map<UUID, TaskRecord> taskRecords = new ConcurrentHashMap<>();
  private final Map<UUID, Future<?>> pendingRuns = new ConcurrentHashMap<>();
  private final Deque<TaskRecord> taskHistory = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean acceptingTasks = new AtomicBoolean(true);
  private final AtomicInteger runningTasks = new AtomicInteger();
  private final Outcomes outcomes = new Outcomes();

  /**
   * @throws IllegalStateException if two processors claim the same task type
   */
  public LoadTaskService(
      TaskProcessingCfg properties,
      LoadMetricsRegistry metricsRegistry,
      List<LoadTaskProcessor> processors) {
    this.properties = properties;
    this.metricsRegistry = metricsRegistry;
    this.processors = routeByType(processors);
    this.executor = createExecutor(properties.getConcurrency());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "LoadTaskService ready: concurrency={} historySize={} taskTypes={}",
        properties.getConcurrency(),
        properties.getHistorySize(),
        processors.keySet());
  }

  private static ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadPoolExecutor pool =
        (ThreadPoolExecutor)
            newFixedThreadPool(
                concurrency,
                runnable -> {
                  Thread thread = new Thread(runnable);
                  thread.setName("contention-task-" + thread.getId());
                  thread.setDaemon(true);
                  return thread;
                });
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Task queue is full");
        });
    return pool;
  }

  private static Map<TaskType, LoadTaskProcessor> routeByType(List<LoadTaskProcessor> candidates) {
    Map<TaskType, LoadTaskProcessor> routes = new EnumMap<>(TaskType.class);
    for (LoadTaskProcessor processor : candidates) {
      Objects.requireNonNull(processor, "Processor entry cannot be null");
      Set<TaskType> declared =
          Objects.requireNonNull(
              processor.supportedTaskTypes(), "Processor must declare supported task types");
      for (TaskType type : declared) {
        if (routes.putIfAbsent(type, processor) != null) {
          throw new IllegalStateException("Multiple processors registered for task type " + type);
        }
      }
    }
    return Map.copyOf(routes);
  }

  /**
   * Queues a run.
   *
   * @return empty once the service has shut down; otherwise the outcome at submission time, which
   *     is ERROR for an unroutable type, a duplicate id or a full queue
   */
  public Optional<TaskSubmissionOutcome> submitTask(LoadTask task) {
    if (!acceptingTasks.get()) {
      return Optional.empty();
    }
    UUID taskId = task.getId();
    if (!processors.containsKey(task.getTaskType())) {
      return Optional.of(
          rejected(taskId, "No processor available for task type " + task.getTaskType().name()));
    }

    var record = new TaskRecord(task, Instant.now());
    if (taskRecords.putIfAbsent(taskId, record) != null) {
      return Optional.of(rejected(taskId, "Task ID already exists"));
    }

    try {
      Future<?> pending = executor.submit(() -> run(record));
      pendingRuns.put(taskId, pending);
      if (pending.isDone()) {
        pendingRuns.remove(taskId);
      }
    } catch (RejectedExecutionException ex) {
      log.warn("Task {} rejected: {}", taskId, ex.getMessage());
      taskRecords.remove(taskId);
      return Optional.of(rejected(taskId, "Task queue is full"));
    }
    log.info("Task {} submitted (type={})", taskId, task.getTaskType());
    var status = record.getStatus();
    return Optional.of(new TaskSubmissionOutcome(taskId, status, SUBMISSION_MESSAGES.get(status)));
  }

  private static TaskSubmissionOutcome rejected(UUID taskId, String message) {
    return new TaskSubmissionOutcome(taskId, TaskStatus.ERROR, message);
  }

  private void run(TaskRecord record) {
    var taskId = record.getTaskId();
    if (record.getStatus() != TaskStatus.QUEUED) {
      log.debug("Task {} skipped, already {}", taskId, record.getStatus());
      return;
    }

    record.markProcessing(Instant.now());
    runningTasks.incrementAndGet();
    log.info("Task {} started", taskId);
    try {
      LoadTask task = record.getTask();
      LoadTaskProcessor processor = processors.get(task.getTaskType());
      if (processor == null) {
        throw new IllegalStateException(
            "No processor registered for task type " + task.getTaskType());
      }
      processor.execute(toSubmissionRequest(task));

      record.markCompleted(Instant.now());
      outcomes.recordCompleted(record.getProcessingDurationMillis());
      log.info("Task {} completed in {} ms", taskId, record.getProcessingDurationMillis());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      record.markCancelled(Instant.now());
      outcomes.cancelled.incrementAndGet();
      log.info("Task {} cancelled", taskId);
    } catch (Exception ex) {
      record.markErrored(Instant.now(), ex.getMessage());
      outcomes.failed.incrementAndGet();
      log.error("Task {} failed: {}", taskId, ex.getMessage(), ex);
    } finally {
      runningTasks.decrementAndGet();
      finish(record);
    }
  }

  private void finish(TaskRecord record) {
    pendingRuns.remove(record.getTaskId());
    taskHistory.addFirst(record);
    while (taskHistory.size() > properties.getHistorySize()) {
      var evicted = taskHistory.pollLast();
      if (evicted == null) {
        break;
      }
      taskRecords.remove(evicted.getTaskId());
      metricsRegistry.evict(evicted.getTaskId());
      log.debug("Task {} evicted from history", evicted.getTaskId());
    }
  }

  private static TaskSubmissionRequest toSubmissionRequest(LoadTask task) {
    TaskSubmissionRequest request = new TaskSubmissionRequest();
    request.setTaskId(task.getId().toString());
    request.setTaskType(task.getTaskType().name());
    request.setCreatedAt(task.getCreatedAt());
    request.setData(task.getData());
    return request;
  }

  public Optional<TaskStatusResponse> getTaskStatus(UUID taskId) {
    return Optional.ofNullable(taskRecords.get(taskId)).map(LoadTaskService::toStatusResponse);
  }

  public Collection<TaskStatusResponse> getAllTasks() {
    return taskRecords.values().stream().map(LoadTaskService::toStatusResponse).toList();
  }

  public List<TaskSummaryResponse> getTasksByStatus(TaskStatus status) {
    return taskRecords.values().stream()
        .filter(record -> record.getStatus() == status)
        .map(
            record ->
                new TaskSummaryResponse(
                    record.getTaskId(),
                    record.getTask().getTaskType().name(),
                    record.getStatus(),
                    record.getSubmittedAt()))
        .toList();
  }

  /** Finished runs, most recent first. */
  public List<TaskHistoryEntry> getTaskHistory() {
    return taskHistory.stream()
        .map(
            record ->
                new TaskHistoryEntry(
                    record.getTaskId(),
                    record.getTask().getTaskType().name(),
                    record.getStatus(),
                    record.getStartedAt().orElse(null),
                    record.getCompletedAt().orElse(null),
                    record.getProcessingDurationMillis(),
                    record.getErrorMessage().orElse(null)))
        .toList();
  }

  public QueueStatusResponse getQueueStatus() {
    return new QueueStatusResponse(
        executor.getQueue().size(), runningTasks.get(), acceptingTasks.get());
  }

  public TaskMetricsResponse getMetrics() {
    return outcomes.toResponse();
  }

  /**
   * Cancels a run. A queued run is marked CANCELLED at once. A running run is interrupted and its
   * processor is told to stop; it turns CANCELLED once its report has been saved.
   */
  public CancellationResult cancelTask(UUID taskId) {
    var record = taskRecords.get(taskId);
    if (record == null) {
      return CancellationResult.notFound();
    }
    var status = record.getStatus();
    if (status != TaskStatus.QUEUED && status != TaskStatus.PROCESSING) {
      return CancellationResult.notCancellable(status);
    }

    var processor = processors.get(record.getTask().getTaskType());
    Future<?> pending = pendingRuns.get(taskId);
    if (pending != null && !pending.cancel(true)) {
      return CancellationResult.notCancellable(record.getStatus());
    }
    if (processor != null) {
      processor.cancel(taskId);
    }
    if (status == TaskStatus.PROCESSING) {
      log.info("Task {} cancellation requested", taskId);
      return CancellationResult.cancellationRequested(record.getStatus());
    }

    record.markCancelled(Instant.now());
    outcomes.cancelled.incrementAndGet();
    finish(record);
    log.info("Task {} cancelled while queued", taskId);
    return CancellationResult.cancelled(record.getStatus());
  }

  public Set<String> getSupportedTaskTypes() {
    return processors.keySet().stream().map(TaskType::name).collect(Collectors.toUnmodifiableSet());
  }

  /** Stops accepting runs. Runs already queued or running are left to finish. */
  public void shutdown() {
    if (acceptingTasks.compareAndSet(true, false)) {
      executor.shutdown();
      log.info("LoadTaskService no longer accepting tasks");
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  public boolean isHealthy() {
    return acceptingTasks.get() && !executor.isShutdown();
  }

  private static TaskStatusResponse toStatusResponse(TaskRecord record) {
    return new TaskStatusResponse(
        record.getTaskId(),
        record.getTask().getTaskType().name(),
        record.getStatus(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getErrorMessage().orElse(null));
  }

  /** Outcome counters across every run this instance has finished. */
  private static final class Outcomes {
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong completedMillis = new AtomicLong();

    void recordCompleted(long durationMillis) {
      completed.incrementAndGet();
      completedMillis.addAndGet(durationMillis);
    }

    TaskMetricsResponse toResponse() {
      long done = completed.get();
      long errored = failed.get();
      long finished = done + errored;
      return new TaskMetricsResponse(
          done,
          errored,
          cancelled.get(),
          done == 0 ? 0.0 : (double) completedMillis.get() / done,
          finished == 0 ? 0.0 : (double) done / finished,
          finished);
    }
  }

  @Getter
  public static final class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final TaskStatus taskStatus;

    private CancellationResult(CancellationState state, TaskStatus taskStatus) {
      this.state = state;
      this.taskStatus = taskStatus;
    }

    public static CancellationResult cancelled(TaskStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    public static CancellationResult cancellationRequested(TaskStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(TaskStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
