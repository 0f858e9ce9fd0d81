package com.mk.fx.qa.load.contention.processors.conflict;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.contention.conflict.BackoffPolicy;
import com.mk.fx.qa.load.contention.conflict.ConflictRetryStateMachine;
import com.mk.fx.qa.load.contention.conflict.FieldUpdateVariant;
import com.mk.fx.qa.load.contention.conflict.ResourceEndpoints;
import com.mk.fx.qa.load.contention.conflict.RetryPolicy;
import com.mk.fx.qa.load.contention.executors.closed.CyclePacer;
import com.mk.fx.qa.load.contention.metrics.LoadMetrics;
import com.mk.fx.qa.load.contention.metrics.RunConfig;
import com.mk.fx.qa.load.contention.model.UpdateType;
import com.mk.fx.qa.load.contention.partition.IdPartitioner;
import com.mk.fx.qa.load.contention.rest.LoadHttpClient;
import com.mk.fx.qa.load.contention.rest.Request;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.rest.TransportException;
import com.mk.fx.qa.load.contention.store.VersionedResourceStore;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConflictWorkerTest {

  private final VersionedResourceStore store = new VersionedResourceStore(List.of("a", "b"));
  private final IdPartitioner partitioner = new IdPartitioner(2, 1);
  private final List<Request> sent = new ArrayList<>();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private ConflictRetryStateMachine machine(int retryCount) {
    return new ConflictRetryStateMachine(
        partitioner.partitionFor(0),
        store,
        new FieldUpdateVariant(List.of(UpdateType.PRIORITY)),
        new RetryPolicy(retryCount, 2, 16, BackoffPolicy.FIXED),
        ResourceEndpoints.defaults(),
        new Random(3));
  }

  private static LoadMetrics metrics(boolean countExcluded) {
    return new LoadMetrics(
        new RunConfig(
            "worker-test",
            "TASKS_UPDATE",
            "http://localhost",
            1,
            1,
            0,
            2,
            10,
            Duration.ZERO,
            Duration.ZERO,
            Duration.ZERO,
            null,
            1,
            2,
            16,
            "FIXED",
            List.of("PRIORITY"),
            countExcluded,
            List.of()));
  }

  private RequestSender answering(int status) {
    return request -> {
      sent.add(request);
      return new RestResponseData(status, Map.of(), "{}", 2);
    };
  }

  @Test
  void successfulCycle_feedsMachineAndMetrics() throws Exception {
    var machine = machine(0);
    var metrics = metrics(true);
    metrics.registerWorker(machine);
    var worker = new ConflictWorker(machine, answering(200), metrics, true);

    worker.runCycle(CyclePacer.unpaced());

    assertEquals(1, sent.size());
    assertEquals("/tasks/b", sent.get(0).getPath());
    assertEquals(1, metrics.completedRequests(0));
    assertEquals(1, metrics.executedResponses());
    assertEquals(2L, store.getState(2).version());
    assertSame(machine, worker.machine());
  }

  @Test
  void excludedCycles_skipThePacer_whenNotCountedInRate() throws Exception {
    var machine = machine(1);
    var metrics = metrics(false);
    metrics.registerWorker(machine);
    var worker = new ConflictWorker(machine, answering(409), metrics, false);
    var pacer = CyclePacer.of(1000.0, () -> false);

    worker.runCycle(pacer);
    assertTrue(machine.nextCycleExcluded());
    long before = System.nanoTime();
    worker.runCycle(pacer);
    long elapsedMs = (System.nanoTime() - before) / 1_000_000;

    assertEquals(2, sent.size());
    assertEquals("/health", sent.get(1).getPath());
    assertEquals(2, metrics.completedRequests(0));
    assertEquals(1, metrics.executedResponses());
    assertTrue(elapsedMs < 500, "excluded cycle should not wait for a slot");
  }

  @Test
  void transportFailure_isRecorded_andTheWorkerCarriesOn() throws Exception {
    var machine = machine(0);
    var metrics = metrics(true);
    metrics.registerWorker(machine);
    RequestSender failing =
        request -> {
          throw new TransportException("connection refused", new IOException("refused"));
        };
    var worker = new ConflictWorker(machine, failing, metrics, true);

    worker.runCycle(CyclePacer.unpaced());

    assertEquals(1, metrics.completedRequests(0));
    assertEquals(0, metrics.executedResponses());
    assertEquals(1, metrics.totalErrors());
    assertEquals(1, machine.report().categories().executed());
  }

  @Test
  void interruptedMidRequest_abandonsTheRequest() {
    var machine = machine(0);
    var metrics = metrics(true);
    metrics.registerWorker(machine);
    RequestSender interrupted =
        request -> {
          Thread.currentThread().interrupt();
          throw new TransportException(
              "Interrupted while awaiting response", new InterruptedException());
        };
    var worker = new ConflictWorker(machine, interrupted, metrics, true);

    assertThrows(InterruptedException.class, () -> worker.runCycle(CyclePacer.unpaced()));
    assertEquals(1, metrics.completedRequests(0));
    assertEquals(0, metrics.totalErrors());
    assertEquals(machine.report().categories().sum(), metrics.completedRequests(0));
  }

  @Test
  void idsWithSpaces_overRealClient_failAsTransportErrors_andTheWorkerCarriesOn()
      throws Exception {
    var spaced = new VersionedResourceStore(List.of("task 0", "task 1"));
    var machine =
        new ConflictRetryStateMachine(
            partitioner.partitionFor(0),
            spaced,
            new FieldUpdateVariant(List.of(UpdateType.PRIORITY)),
            new RetryPolicy(0, 2, 16, BackoffPolicy.FIXED),
            ResourceEndpoints.defaults(),
            new Random(3));
    var metrics = metrics(true);
    metrics.registerWorker(machine);

    try (var client = new LoadHttpClient("http://127.0.0.1:1", 1, 1, Map.of())) {
      RequestSender recording =
          request -> {
            sent.add(request);
            return client.execute(request);
          };
      var worker = new ConflictWorker(machine, recording, metrics, true);

      worker.runCycle(CyclePacer.unpaced());
      worker.runCycle(CyclePacer.unpaced());
    }

    assertEquals("/tasks/task%201", sent.get(0).getPath());
    assertEquals("/tasks/task%200", sent.get(1).getPath());
    assertFalse(machine.classifier().hasPending());
    assertEquals(2, metrics.completedRequests(0));
    assertEquals(2, metrics.totalErrors());
    assertEquals(machine.report().categories().sum(), metrics.completedRequests(0));
  }
}
