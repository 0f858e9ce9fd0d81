package com.mk.fx.qa.load.contention.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.contention.classify.CategoryCounts;
import com.mk.fx.qa.load.contention.classify.RequestCategory;
import com.mk.fx.qa.load.contention.conflict.ConflictRetryStateMachine;
import com.mk.fx.qa.load.contention.conflict.PlannedRequest;
import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.store.ResourceState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Metrics for one run: completed requests per worker, latency and status distribution of executed
 * requests, failures, and live category counts read from the registered workers.
 */
@Slf4j
public class LoadMetrics {

  @Getter private final RunConfig config;

  private final Instant startedAt = Instant.now();
  private final AtomicLongArray completedPerWorker;
  private final AtomicLong executedResponses = new AtomicLong();
  private final LatencyTracker latency = new LatencyTracker(5000);
  private final ErrorTracker errorTracker = new ErrorTracker();
  private final StatusDistribution statusDistribution = new StatusDistribution();
  private final List<ProtocolMetricsProvider> protocolProviders = new CopyOnWriteArrayList<>();
  private final List<ConflictRetryStateMachine> workers = new CopyOnWriteArrayList<>();

  private ScheduledExecutorService snapshots;
  private volatile CompletionInfo completionInfo;

  public LoadMetrics(RunConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.completedPerWorker = new AtomicLongArray(Math.max(1, config.workersRequested()));
    protocolProviders.add(statusDistribution);
  }

  public void start() {
    logStart();
    snapshots =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-snapshots-" + config.taskId());
              t.setDaemon(true);
              return t;
            });
    snapshots.scheduleAtFixedRate(this::snapshot, 5, 5, TimeUnit.SECONDS);
  }

  public void stopAndSummarise() {
    if (snapshots != null) {
      snapshots.shutdownNow();
      try {
        snapshots.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    logFinalSummary();
  }

  public void registerWorker(ConflictRetryStateMachine machine) {
    workers.add(machine);
  }

  public void setCompletionContext(
      boolean cancelled, boolean durationExpired, int totalWorkers, int completedWorkers) {
    this.completionInfo =
        new CompletionInfo(cancelled, durationExpired, totalWorkers, completedWorkers);
  }

  /** A response arrived. Only executed requests feed latency, status and error statistics. */
  public void recordResponse(int workerIndex, PlannedRequest planned, RestResponseData response) {
    completedPerWorker.incrementAndGet(workerIndex);
    if (planned.category() != RequestCategory.EXECUTED) {
      return;
    }
    executedResponses.incrementAndGet();
    latency.record(response.getResponseTimeMs());
    statusDistribution.record(planned.endpoint(), response.getStatusCode(), response.getResponseTimeMs());
    if (response.getStatusCode() >= 400) {
      errorTracker.recordHttpError(response.getStatusCode());
    }
  }

  public void recordTransportFailure(int workerIndex, PlannedRequest planned, Throwable failure) {
    completedPerWorker.incrementAndGet(workerIndex);
    errorTracker.recordTransportFailure(failure);
    log.warn(
        "Task {} worker {} transport failure on {}: {}",
        config.taskId(),
        workerIndex,
        planned.endpoint(),
        failure.getMessage());
  }

  /** The request was cut short by the run stopping; it completes without an outcome. */
  public void recordAbandoned(int workerIndex) {
    completedPerWorker.incrementAndGet(workerIndex);
  }

  public long completedRequests(int workerIndex) {
    return completedPerWorker.get(workerIndex);
  }

  public long totalCompletedRequests() {
    long total = 0;
    for (int i = 0; i < completedPerWorker.length(); i++) {
      total += completedPerWorker.get(i);
    }
    return total;
  }

  public long executedResponses() {
    return executedResponses.get();
  }

  public long totalErrors() {
    return errorTracker.totalErrors();
  }

  public Map<String, Long> errorBreakdown() {
    return errorTracker.breakdownSnapshot();
  }

  public StatusDistribution statusDistribution() {
    return statusDistribution;
  }

  /** Category counts summed over every registered worker, as classified so far. */
  public CategoryCounts categoriesSoFar() {
    var total = CategoryCounts.ZERO;
    for (ConflictRetryStateMachine machine : workers) {
      total = total.plus(machine.classifier().snapshot());
    }
    return total;
  }

  /**
   * Requests per second since the run started. Counts every completed request when excluded
   * cycles are counted in the rate, otherwise executed responses only.
   */
  public double achievedRps() {
    double elapsedSec =
        Math.max(0.001, Duration.between(startedAt, Instant.now()).toMillis() / 1000.0);
    long counted = config.countExcludedInRate() ? totalCompletedRequests() : executedResponses.get();
    return counted / elapsedSec;
  }

  public LoadSnapshot snapshotNow() {
    var categories = categoriesSoFar();
    var aggregator = aggregate();
    return new LoadSnapshot(
        config,
        totalCompletedRequests(),
        categories.executed(),
        categories.backoff(),
        categories.suppressed(),
        categories.fallback(),
        aggregator.successfulRetries(),
        aggregator.exhaustedRetries(),
        aggregator.conflicts(),
        totalErrors(),
        achievedRps(),
        latency.minMs().orElse(null),
        latency.avgMs().orElse(null),
        latency.maxMs().orElse(null));
  }

  public ContentionRunReport buildReport(List<ResourceState> store) {
    return new ContentionReportBuilder()
        .build(
            config,
            startedAt,
            aggregate(),
            executedResponses.get(),
            achievedRps(),
            latency,
            errorTracker,
            statusDistribution,
            protocolProviders,
            store,
            completionInfo);
  }

  ResultAggregator aggregate() {
    var aggregator = new ResultAggregator();
    for (ConflictRetryStateMachine machine : workers) {
      int index = machine.partition().workerIndex();
      aggregator.add(machine.report(), completedPerWorker.get(index));
    }
    return aggregator;
  }

  private void logStart() {
    var sb = new StringBuilder();
    sb.append("Task ")
        .append(config.taskId())
        .append(" started: type=")
        .append(config.taskType())
        .append(", baseUrl=")
        .append(config.baseUrl())
        .append(", workers=")
        .append(config.workersRequested())
        .append(" (active=")
        .append(config.workersEffective())
        .append(", suppressed=")
        .append(config.suppressedWorkers())
        .append("), idPool=")
        .append(config.idPoolSize())
        .append(", cyclesPerWorker=")
        .append(config.cyclesPerWorker() > 0 ? config.cyclesPerWorker() : "unbounded")
        .append(", duration=")
        .append(config.duration())
        .append(", retryCount=")
        .append(config.retryCount())
        .append(", backoff=")
        .append(config.backoffPolicy())
        .append("(base=")
        .append(config.backoffBase())
        .append(", max=")
        .append(config.backoffMax())
        .append(")");
    if (config.expectedRps() != null) {
      sb.append(", expectedRps=").append(String.format("%.2f", config.expectedRps()));
    }
    if (!config.defaultedSettings().isEmpty()) {
      sb.append(", defaulted=").append(config.defaultedSettings());
    }
    log.info(sb.toString());
  }

  private void snapshot() {
    var sb = new StringBuilder();
    sb.append("Task ").append(config.taskId()).append(" snapshot: ");
    appendProgress(sb);
    log.info(sb.toString());
  }

  @VisibleForTesting
  void forceSnapshotForTest() {
    snapshot();
  }

  private void logFinalSummary() {
    var sb = new StringBuilder();
    sb.append("Task ")
        .append(config.taskId())
        .append(" summary type=")
        .append(config.taskType())
        .append(", ");
    appendProgress(sb);
    if (totalErrors() > 0) {
      sb.append(", errors=").append(totalErrors());
    }
    sb.append(", errorRate=")
        .append(String.format("%.2f%%", statusDistribution.actualErrorRate() * 100));
    log.info(sb.toString());
  }

  private void appendProgress(StringBuilder sb) {
    var categories = categoriesSoFar();
    var aggregator = aggregate();
    var rps = achievedRps();
    sb.append("requests=")
        .append(totalCompletedRequests())
        .append(", executed=")
        .append(categories.executed())
        .append(", backoff=")
        .append(categories.backoff())
        .append(", suppressed=")
        .append(categories.suppressed())
        .append(", fallback=")
        .append(categories.fallback())
        .append(", conflicts=")
        .append(aggregator.conflicts())
        .append(", retries ok/exhausted=")
        .append(aggregator.successfulRetries())
        .append("/")
        .append(aggregator.exhaustedRetries());
    if (config.expectedRps() != null) {
      sb.append(", rps actual/expected=")
          .append(String.format("%.2f", rps))
          .append("/")
          .append(String.format("%.2f", config.expectedRps()));
    } else {
      sb.append(", rps actual=").append(String.format("%.2f", rps));
    }
    latency.minMs().ifPresent(min -> sb.append(", lat(ms) min=").append(min));
    latency.avgMs().ifPresent(avg -> sb.append(", avg=").append(avg));
    latency.maxMs().ifPresent(max -> sb.append(", max=").append(max));
    latency.p95Ms().ifPresent(p95 -> sb.append(", p95=").append(p95));
    latency.p99Ms().ifPresent(p99 -> sb.append(", p99=").append(p99));
  }

  public Optional<Long> latencyP95Ms() {
    return latency.p95Ms();
  }
}
