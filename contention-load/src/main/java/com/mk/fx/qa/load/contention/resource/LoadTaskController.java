package com.mk.fx.qa.load.contention.resource;

import static com.mk.fx.qa.load.contention.model.TaskStatus.CANCELLED;
import static com.mk.fx.qa.load.contention.model.TaskStatus.PROCESSING;

import com.mk.fx.qa.load.contention.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskCancellationResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskLiveMetricsResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionOutcome;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionResponse;
import com.mk.fx.qa.load.contention.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.contention.metrics.LoadSnapshot;
import com.mk.fx.qa.load.contention.model.LoadTask;
import com.mk.fx.qa.load.contention.model.TaskStatus;
import com.mk.fx.qa.load.contention.service.LoadTaskService;
import com.mk.fx.qa.load.contention.service.LoadTaskService.CancellationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface for contention runs. Submissions are queued on {@link LoadTaskService}; live
 * metrics and final reports come from {@link LoadMetricsRegistry}.
 */
@Slf4j
@Tag(name = "Contention Tasks", description = "Queue, inspect and cancel contention load runs")
@RestController
@RequestMapping("/api/tasks")
@Validated
@RequiredArgsConstructor
public class LoadTaskController {

  private static final String UP = "UP";
  private static final String DOWN = "DOWN";

  private final LoadTaskService loadTaskService;
  private final LoadMetricsRegistry metricsRegistry;
  private final TaskMapper taskMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Queue a contention run",
      description = "Accepts a TASKS_UPDATE or TASKS_UPDATE_STATUS definition.")
  @PostMapping
  public ResponseEntity<TaskSubmissionResponse> submitTask(
      @Valid @RequestBody TaskSubmissionRequest request) {
    log.info("Submitting {} run", request.getTaskType());
    LoadTask loadTask = taskMapper.toDomain(request);
    Optional<TaskSubmissionOutcome> submitted = loadTaskService.submitTask(loadTask);
    if (submitted.isEmpty()) {
      return responseFactory.unavailable(
          new TaskSubmissionResponse(null, CANCELLED, "Service not accepting new tasks"));
    }
    TaskSubmissionOutcome outcome = submitted.get();
    return ResponseEntity.status(httpStatusOf(outcome.status()))
        .body(new TaskSubmissionResponse(outcome.taskId(), outcome.status(), outcome.message()));
  }

  @Operation(summary = "Run status", description = "Lifecycle state and timings of one run.")
  @GetMapping("/{taskId}")
  public ResponseEntity<TaskStatusResponse> getTaskStatus(@PathVariable UUID taskId) {
    Optional<TaskStatusResponse> status = loadTaskService.getTaskStatus(taskId);
    if (status.isEmpty()) {
      log.warn("Status requested for unknown task {}", taskId);
    }
    return ResponseEntity.of(status);
  }

  @Operation(
      summary = "Cancel a run",
      description = "A queued run is dropped; a running one is stopped and keeps its report.")
  @DeleteMapping("/{taskId}")
  public ResponseEntity<?> cancelTask(@PathVariable UUID taskId) {
    CancellationResult result = loadTaskService.cancelTask(taskId);
    log.info("Cancel {} -> {}", taskId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Task not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Task cannot be cancelled in its current state");
      case CANCELLED -> ResponseEntity.ok(
          new TaskCancellationResponse(taskId, CANCELLED, "Task cancelled"));
      case CANCELLATION_REQUESTED -> ResponseEntity.ok(
          new TaskCancellationResponse(
              taskId, statusAfterStopRequest(taskId), "Cancellation requested"));
    };
  }

  // the run may already have wound down between the cancel and this lookup
  private TaskStatus statusAfterStopRequest(UUID taskId) {
    return loadTaskService.getTaskStatus(taskId).map(TaskStatusResponse::status).orElse(PROCESSING);
  }

  @Operation(summary = "List runs", description = "All known runs, optionally filtered by status.")
  @GetMapping
  public ResponseEntity<?> getTasks(@RequestParam(required = false) String status) {
    if (status == null) {
      return ResponseEntity.ok(loadTaskService.getAllTasks());
    }
    Optional<TaskStatus> filter = parseStatus(status);
    if (filter.isEmpty()) {
      log.warn("Rejected status filter '{}'", status);
      return responseFactory.error(
          HttpStatus.BAD_REQUEST,
          "Invalid Status",
          "Unrecognized status: " + status + ". Allowed: " + Arrays.toString(TaskStatus.values()));
    }
    return ResponseEntity.ok(loadTaskService.getTasksByStatus(filter.get()));
  }

  @GetMapping("/history")
  public ResponseEntity<List<TaskHistoryEntry>> getTaskHistory() {
    return ResponseEntity.ok(loadTaskService.getTaskHistory());
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return ResponseEntity.ok(loadTaskService.getQueueStatus());
  }

  @Operation(summary = "Service outcome counts", description = "Totals over every finished run.")
  @GetMapping("/metrics")
  public ResponseEntity<TaskMetricsResponse> getMetrics() {
    return ResponseEntity.ok(loadTaskService.getMetrics());
  }

  @Operation(
      summary = "Live run metrics",
      description = "Request categories, retry outcomes, error totals and latency so far.")
  @GetMapping("/{taskId}/metrics")
  public ResponseEntity<?> getTaskMetrics(@PathVariable UUID taskId) {
    return found(
        metricsRegistry.getSnapshot(taskId).map(this::toLiveMetrics),
        "Metrics not found for task: " + taskId);
  }

  @Operation(
      summary = "Final run report",
      description = "Categories, retries, status distribution, store contents and summary status.")
  @GetMapping("/{taskId}/report")
  public ResponseEntity<?> getTaskReport(@PathVariable UUID taskId) {
    return found(metricsRegistry.getReport(taskId), "Report not found for task: " + taskId);
  }

  @GetMapping("/types")
  public ResponseEntity<Set<String>> getSupportedTaskTypes() {
    return ResponseEntity.ok(loadTaskService.getSupportedTaskTypes());
  }

  @Operation(summary = "Health", description = "UP while the service accepts runs.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse(loadTaskService.isHealthy() ? UP : DOWN));
  }

  private ResponseEntity<?> found(Optional<?> body, String missingMessage) {
    if (body.isPresent()) {
      return ResponseEntity.ok(body.get());
    }
    log.warn("{}", missingMessage);
    return responseFactory.notFound(missingMessage);
  }

  private static Optional<TaskStatus> parseStatus(String raw) {
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(TaskStatus.values())
        .filter(candidate -> candidate.name().equals(normalized))
        .findFirst();
  }

  private static HttpStatus httpStatusOf(TaskStatus status) {
    return switch (status) {
      case COMPLETED -> HttpStatus.OK;
      case ERROR -> HttpStatus.BAD_REQUEST;
      case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
      case QUEUED, PROCESSING -> HttpStatus.ACCEPTED;
    };
  }

  private TaskLiveMetricsResponse toLiveMetrics(LoadSnapshot snapshot) {
    var cfg = snapshot.config();
    return TaskLiveMetricsResponse.builder()
        .taskId(cfg.taskId())
        .taskType(cfg.taskType())
        .baseUrl(cfg.baseUrl())
        .workersRequested(cfg.workersRequested())
        .workersEffective(cfg.workersEffective())
        .suppressedWorkers(cfg.suppressedWorkers())
        .idPoolSize(cfg.idPoolSize())
        .cyclesPerWorker(cfg.cyclesPerWorker())
        .warmup(cfg.warmup())
        .rampUp(cfg.rampUp())
        .duration(cfg.duration())
        .ratePerWorker(cfg.ratePerWorker())
        .expectedRps(cfg.expectedRps())
        .completedRequests(snapshot.completedRequests())
        .executed(snapshot.executed())
        .backoff(snapshot.backoff())
        .suppressed(snapshot.suppressed())
        .fallback(snapshot.fallback())
        .successfulRetries(snapshot.successfulRetries())
        .exhaustedRetries(snapshot.exhaustedRetries())
        .conflicts(snapshot.conflicts())
        .totalErrors(snapshot.totalErrors())
        .achievedRps(snapshot.achievedRps())
        .latencyMinMs(snapshot.latencyMinMs())
        .latencyAvgMs(snapshot.latencyAvgMs())
        .latencyMaxMs(snapshot.latencyMaxMs())
        .build();
  }
}
