package com.mk.fx.qa.load.contention.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.contention.conflict.BackoffPolicy;
import com.mk.fx.qa.load.contention.conflict.ConflictRetryStateMachine;
import com.mk.fx.qa.load.contention.conflict.FieldUpdateVariant;
import com.mk.fx.qa.load.contention.conflict.ResourceEndpoints;
import com.mk.fx.qa.load.contention.conflict.RetryPolicy;
import com.mk.fx.qa.load.contention.model.UpdateType;
import com.mk.fx.qa.load.contention.partition.IdPartitioner;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.rest.TransportException;
import com.mk.fx.qa.load.contention.store.VersionedResourceStore;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class LoadMetricsTest {

  private final VersionedResourceStore store = new VersionedResourceStore(List.of("a", "b"));

  private static RunConfig config(int workers, boolean countExcluded) {
    return new RunConfig(
        "t-1",
        "TASKS_UPDATE",
        "http://localhost",
        workers,
        Math.min(workers, 2),
        Math.max(0, workers - 2),
        2,
        10,
        Duration.ZERO,
        Duration.ZERO,
        Duration.ZERO,
        null,
        0,
        2,
        16,
        "FIXED",
        List.of("PRIORITY"),
        countExcluded,
        List.of());
  }

  private ConflictRetryStateMachine machine(IdPartitioner partitioner, int index) {
    return new ConflictRetryStateMachine(
        partitioner.partitionFor(index),
        store,
        new FieldUpdateVariant(List.of(UpdateType.PRIORITY)),
        new RetryPolicy(0, 2, 16, BackoffPolicy.FIXED),
        ResourceEndpoints.defaults(),
        new Random(1));
  }

  private static RestResponseData response(int status, long latencyMs) {
    return new RestResponseData(status, Map.of(), "{}", latencyMs);
  }

  private static void cycle(
      LoadMetrics metrics, ConflictRetryStateMachine machine, int status, long latencyMs) {
    var planned = machine.nextRequest();
    var response = response(status, latencyMs);
    machine.onResponse(response);
    metrics.recordResponse(machine.partition().workerIndex(), planned, response);
  }

  @Test
  void onlyExecutedRequests_feedStatusAndLatency() {
    var partitioner = new IdPartitioner(2, 3);
    var metrics = new LoadMetrics(config(3, true));
    var active = machine(partitioner, 0);
    var suppressed = machine(partitioner, 2);
    metrics.registerWorker(active);
    metrics.registerWorker(suppressed);

    cycle(metrics, active, 200, 10);
    cycle(metrics, active, 409, 30);
    cycle(metrics, suppressed, 200, 1);
    cycle(metrics, suppressed, 200, 1);

    assertEquals(4, metrics.totalCompletedRequests());
    assertEquals(2, metrics.executedResponses());
    assertEquals(2, metrics.statusDistribution().total());
    assertEquals(1L, metrics.errorBreakdown().get("HTTP_409"));

    var snapshot = metrics.snapshotNow();
    assertEquals(2, snapshot.executed());
    assertEquals(2, snapshot.suppressed());
    assertEquals(1, snapshot.conflicts());
    assertEquals(1, snapshot.exhaustedRetries());
    assertEquals(10L, snapshot.latencyMinMs());
    assertEquals(30L, snapshot.latencyMaxMs());
  }

  @Test
  void report_balancesCategoriesWithCompletedRequests() {
    var partitioner = new IdPartitioner(2, 1);
    var metrics = new LoadMetrics(config(1, true));
    var worker = machine(partitioner, 0);
    metrics.registerWorker(worker);

    cycle(metrics, worker, 200, 5);
    cycle(metrics, worker, 200, 5);
    var planned = worker.nextRequest();
    var failure = new TransportException("I/O error", new ConnectException("refused"));
    worker.onTransportFailure(failure);
    metrics.recordTransportFailure(0, planned, failure);
    worker.nextRequest();
    worker.onAbandoned();
    metrics.recordAbandoned(0);
    metrics.setCompletionContext(false, false, 1, 1);

    var report = metrics.buildReport(store.snapshot());

    assertEquals(4, report.metrics.completedRequests);
    assertEquals(4, report.categories.executed);
    assertEquals(1, report.metrics.transportFailures);
    assertTrue(report.consistencyWarnings.isEmpty());
    assertEquals("ALL_WORKERS_FINISHED", report.completion.reason);
    assertEquals("FAILED", report.summary.status);
    assertThat(report.summary.concerns).contains("transportFailures=1");
    assertEquals(2, report.store.size());
    assertEquals(2L, report.store.get(0).version);
    assertEquals(2L, report.store.get(1).version);
    assertEquals(1, report.workers.size());
    assertEquals(4, report.workers.get(0).completedRequests);
  }

  @Test
  void conflictsAlone_stillCountAsSuccess() {
    var partitioner = new IdPartitioner(2, 1);
    var metrics = new LoadMetrics(config(1, true));
    var worker = machine(partitioner, 0);
    metrics.registerWorker(worker);

    cycle(metrics, worker, 409, 5);
    cycle(metrics, worker, 200, 5);
    metrics.setCompletionContext(false, true, 1, 0);

    var report = metrics.buildReport(store.snapshot());

    assertEquals("SUCCESS", report.summary.status);
    assertEquals("DURATION_EXPIRED", report.completion.reason);
    assertEquals(0.5, report.metrics.actualErrorRate, 1e-9);
    assertEquals(1, report.retries.exhausted);
  }

  @Test
  void unconsumedLabel_isReportedAsInconsistent() {
    var partitioner = new IdPartitioner(2, 1);
    var metrics = new LoadMetrics(config(1, true));
    var worker = machine(partitioner, 0);
    metrics.registerWorker(worker);

    cycle(metrics, worker, 200, 5);
    worker.nextRequest();

    var report = metrics.buildReport(store.snapshot());

    assertEquals("INCONSISTENT", report.summary.status);
    assertEquals(List.of("worker 0: completed=1, sum(categories)=2"), report.consistencyWarnings);
    assertEquals("ERROR", report.completion.reason);
  }

  @Test
  void rateExcludingPlaceholders_countsExecutedOnly() {
    var partitioner = new IdPartitioner(1, 2);
    var metrics = new LoadMetrics(config(2, false));
    var suppressed = machine(partitioner, 1);
    metrics.registerWorker(suppressed);

    for (int i = 0; i < 10; i++) {
      cycle(metrics, suppressed, 200, 1);
    }

    assertEquals(10, metrics.totalCompletedRequests());
    assertEquals(0.0, metrics.achievedRps());
  }

  @Test
  void snapshotLogging_doesNotThrow() {
    var metrics = new LoadMetrics(config(1, true));
    metrics.forceSnapshotForTest();
    metrics.stopAndSummarise();
    assertTrue(metrics.latencyP95Ms().isEmpty());
  }
}
