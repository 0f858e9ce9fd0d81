package com.mk.fx.qa.load.contention.processors.conflict;

import static com.mk.fx.qa.load.contention.utils.LoadUtils.parseDuration;
import static com.mk.fx.qa.load.contention.utils.LoadUtils.toSeconds;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.load.contention.cfg.ConflictLoadSettings;
import com.mk.fx.qa.load.contention.conflict.ConflictRetryStateMachine;
import com.mk.fx.qa.load.contention.conflict.FieldUpdateVariant;
import com.mk.fx.qa.load.contention.conflict.ResourceEndpoints;
import com.mk.fx.qa.load.contention.conflict.StatusTransitionVariant;
import com.mk.fx.qa.load.contention.conflict.UpdateVariant;
import com.mk.fx.qa.load.contention.dto.conflict.ConflictLoadTaskDefinition;
import com.mk.fx.qa.load.contention.dto.controllerresponse.TaskSubmissionRequest;
import com.mk.fx.qa.load.contention.executors.closed.ClosedLoadExecutor;
import com.mk.fx.qa.load.contention.executors.closed.ClosedLoadParameters;
import com.mk.fx.qa.load.contention.executors.closed.ClosedLoadResult;
import com.mk.fx.qa.load.contention.metrics.LoadMetrics;
import com.mk.fx.qa.load.contention.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.contention.metrics.RunConfig;
import com.mk.fx.qa.load.contention.model.TaskType;
import com.mk.fx.qa.load.contention.model.UpdateType;
import com.mk.fx.qa.load.contention.partition.IdPartitioner;
import com.mk.fx.qa.load.contention.processors.LoadTaskProcessor;
import com.mk.fx.qa.load.contention.rest.JsonUtil;
import com.mk.fx.qa.load.contention.rest.LoadHttpClient;
import com.mk.fx.qa.load.contention.store.VersionedResourceStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs contention tasks: every worker drives its own {@link ConflictRetryStateMachine} over a
 * disjoint slice of a shared, versioned resource pool.
 */
@Slf4j
@Component
public class ConflictLoadTaskProcessor implements LoadTaskProcessor {

  public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5_000;
  public static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;

  private final Map<UUID, AtomicBoolean> cancellationTokens = new ConcurrentHashMap<>();
  private final LoadMetricsRegistry metricsRegistry;

  public ConflictLoadTaskProcessor(LoadMetricsRegistry metricsRegistry) {
    this.metricsRegistry = metricsRegistry;
  }

  @Override
  public Set<TaskType> supportedTaskTypes() {
    return EnumSet.of(TaskType.TASKS_UPDATE, TaskType.TASKS_UPDATE_STATUS);
  }

  @Override
  public void execute(TaskSubmissionRequest request) throws Exception {
    Objects.requireNonNull(request, "Task request must not be null");
    UUID taskId = UUID.fromString(request.getTaskId());
    TaskType taskType = TaskType.fromValue(request.getTaskType());
    AtomicBoolean cancelled =
        cancellationTokens.computeIfAbsent(taskId, key -> new AtomicBoolean(false));
    cancelled.set(false);

    try {
      ConflictLoadTaskDefinition definition =
          JsonUtil.mapper().convertValue(request.getData(), ConflictLoadTaskDefinition.class);
      validateDefinition(definition);

      var settings = ConflictLoadSettings.fromEnvironment(definition.getSettings(), taskType);
      var target = definition.getTarget();
      var endpoints =
          new ResourceEndpoints(
              orDefault(target.getResourcePath(), ResourceEndpoints.DEFAULT_RESOURCE_PATH),
              orDefault(target.getFallbackPath(), ResourceEndpoints.DEFAULT_FALLBACK_PATH));

      try (LoadHttpClient client = buildClient(target)) {
        List<String> ids = resolveResourceIds(client, definition, settings, endpoints);
        executeRun(taskId, taskType, definition, settings, endpoints, ids, client, cancelled);
      }
    } finally {
      cancellationTokens.remove(taskId);
    }
  }

  @Override
  public void cancel(UUID taskId) {
    cancellationTokens.computeIfAbsent(taskId, key -> new AtomicBoolean(true)).set(true);
  }

  private void executeRun(
      UUID taskId,
      TaskType taskType,
      ConflictLoadTaskDefinition definition,
      ConflictLoadSettings settings,
      ResourceEndpoints endpoints,
      List<String> ids,
      LoadHttpClient client,
      AtomicBoolean cancelled)
      throws Exception {
    var store = new VersionedResourceStore(ids);
    var partitioner = new IdPartitioner(store.size(), settings.workers().value());
    UpdateVariant variant = variantFor(taskType, settings);
    var execution = definition.getExecution();
    var parameters =
        new ClosedLoadParameters(
            partitioner.getWorkerCount(),
            execution.getCyclesPerWorker() != null ? execution.getCyclesPerWorker() : 0L,
            parseDuration(execution.getWarmup()),
            parseDuration(execution.getRampUp()),
            parseDuration(execution.getDuration()),
            execution.getRatePerWorker());

    var metrics = new LoadMetrics(runConfig(taskId, taskType, definition, settings, partitioner, parameters));
    boolean countExcluded = Boolean.TRUE.equals(settings.countExcludedInRate().value());
    List<ConflictWorker> workers = new ArrayList<>(partitioner.getWorkerCount());
    for (var partition : partitioner.partitionAll()) {
      var random =
          settings.workerSeed(partition.workerIndex()).map(Random::new).orElseGet(Random::new);
      var machine =
          new ConflictRetryStateMachine(
              partition, store, variant, settings.retryPolicy(), endpoints, random);
      metrics.registerWorker(machine);
      workers.add(new ConflictWorker(machine, client::execute, metrics, countExcluded));
    }

    metrics.start();
    metricsRegistry.register(taskId, metrics);

    ClosedLoadResult result = null;
    try {
      result =
          ClosedLoadExecutor.execute(
              taskId,
              parameters,
              cancelled::get,
              (workerIndex, cycle, pacer) -> workers.get(workerIndex).runCycle(pacer));
      metrics.setCompletionContext(
          result.cancelled(),
          result.durationExpired(),
          result.totalWorkers(),
          result.completedWorkers());
    } catch (InterruptedException interrupted) {
      metrics.setCompletionContext(true, false, parameters.workers(), 0);
      throw interrupted;
    } finally {
      metrics.stopAndSummarise();
      metricsRegistry.complete(taskId, metrics.snapshotNow());
      var report = metrics.buildReport(store.snapshot());
      metricsRegistry.saveReport(taskId, report);
      try {
        log.info("Task {} run report:\n{}", taskId, JsonUtil.toJson(report));
      } catch (JsonProcessingException e) {
        log.info("Task {} run report (unformatted): {}", taskId, report);
      }
    }

    log.info(
        "Contention run completed: workers={} completedWorkers={} cancelled={} durationExpired={}",
        result.totalWorkers(),
        result.completedWorkers(),
        result.cancelled(),
        result.durationExpired());
    if (result.cancelled()) {
      throw new InterruptedException("Task " + taskId + " cancelled");
    }
  }

  private List<String> resolveResourceIds(
      LoadHttpClient client,
      ConflictLoadTaskDefinition definition,
      ConflictLoadSettings settings,
      ResourceEndpoints endpoints) {
    var configured = definition.getTarget().getResourceIds();
    var poolSize = settings.idPoolSize();
    if (configured == null || configured.isEmpty()) {
      var seed = definition.getSeed();
      int count = seed.getCount() != null ? seed.getCount() : poolSize.value();
      if (count < 1) {
        throw new IllegalArgumentException("seed.count must be at least 1");
      }
      var random = settings.workerSeed(0).map(Random::new).orElseGet(Random::new);
      return new ResourceSeeder(client::execute, endpoints, random).seed(count);
    }
    if (poolSize.defaulted()) {
      return List.copyOf(configured);
    }
    if (poolSize.value() < configured.size()) {
      log.info(
          "{}={} limits the pool to the first {} of {} resource ids",
          ConflictLoadSettings.ID_POOL_SIZE,
          poolSize.value(),
          poolSize.value(),
          configured.size());
      return List.copyOf(configured.subList(0, poolSize.value()));
    }
    if (poolSize.value() > configured.size()) {
      log.warn(
          "{}={} exceeds the {} resource ids given, using {}",
          ConflictLoadSettings.ID_POOL_SIZE,
          poolSize.value(),
          configured.size(),
          configured.size());
    }
    return List.copyOf(configured);
  }

  private static UpdateVariant variantFor(TaskType taskType, ConflictLoadSettings settings) {
    return switch (taskType) {
      case TASKS_UPDATE_STATUS -> new StatusTransitionVariant();
      case TASKS_UPDATE -> new FieldUpdateVariant(settings.updateTypes().value());
    };
  }

  private static RunConfig runConfig(
      UUID taskId,
      TaskType taskType,
      ConflictLoadTaskDefinition definition,
      ConflictLoadSettings settings,
      IdPartitioner partitioner,
      ClosedLoadParameters parameters) {
    var policy = settings.retryPolicy();
    return new RunConfig(
        taskId.toString(),
        taskType.name(),
        definition.getTarget().getBaseUrl(),
        partitioner.getWorkerCount(),
        partitioner.getEffectiveWorkerCount(),
        partitioner.suppressedWorkerCount(),
        partitioner.getPoolSize(),
        parameters.cyclesPerWorker(),
        parameters.warmup(),
        parameters.rampUp(),
        parameters.duration(),
        parameters.ratePerWorker(),
        policy.retryCount(),
        policy.backoffBase(),
        policy.backoffMax(),
        policy.backoffPolicy().name(),
        taskType == TaskType.TASKS_UPDATE
            ? settings.updateTypes().value().stream().map(UpdateType::name).toList()
            : List.of(),
        Boolean.TRUE.equals(settings.countExcludedInRate().value()),
        settings.defaultedKeys());
  }

  private LoadHttpClient buildClient(ConflictLoadTaskDefinition.Target target) {
    ConflictLoadTaskDefinition.TimeoutConfig timeouts = target.getTimeouts();
    int connTimeoutSeconds =
        toSeconds(
            timeouts != null && timeouts.getConnectionTimeoutMs() != null
                ? timeouts.getConnectionTimeoutMs()
                : DEFAULT_CONNECTION_TIMEOUT_MS);
    int requestTimeoutSeconds =
        toSeconds(
            timeouts != null && timeouts.getRequestTimeoutMs() != null
                ? timeouts.getRequestTimeoutMs()
                : DEFAULT_REQUEST_TIMEOUT_MS);
    return new LoadHttpClient(
        target.getBaseUrl(), connTimeoutSeconds, requestTimeoutSeconds, target.getHeaders());
  }

  private void validateDefinition(ConflictLoadTaskDefinition definition) {
    if (definition == null) {
      throw new IllegalArgumentException("Task definition must not be null");
    }
    var target = definition.getTarget();
    if (target == null) {
      throw new IllegalArgumentException("target must be provided");
    }
    if (target.getBaseUrl() == null || target.getBaseUrl().isBlank()) {
      throw new IllegalArgumentException("URL must be provided");
    }
    boolean hasIds = target.getResourceIds() != null && !target.getResourceIds().isEmpty();
    if (!hasIds && definition.getSeed() == null) {
      throw new IllegalArgumentException("Either target.resourceIds or seed must be provided");
    }
    if (hasIds && target.getResourceIds().stream().anyMatch(id -> id == null || id.isBlank())) {
      throw new IllegalArgumentException("target.resourceIds must not contain blank ids");
    }
    var execution = definition.getExecution();
    if (execution == null) {
      throw new IllegalArgumentException("execution must be provided");
    }
    boolean hasCycles = execution.getCyclesPerWorker() != null && execution.getCyclesPerWorker() > 0;
    boolean hasDuration = !parseDuration(execution.getDuration()).isZero();
    if (!hasCycles && !hasDuration) {
      throw new IllegalArgumentException("execution needs cyclesPerWorker or duration");
    }
    if (execution.getRatePerWorker() != null && execution.getRatePerWorker() < 0) {
      throw new IllegalArgumentException("execution.ratePerWorker must not be negative");
    }
    Duration rampUp = parseDuration(execution.getRampUp());
    if (rampUp.isNegative() || parseDuration(execution.getWarmup()).isNegative()) {
      throw new IllegalArgumentException("warmup and rampUp must not be negative");
    }
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
