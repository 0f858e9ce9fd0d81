package com.mk.fx.qa.load.contention.conflict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.contention.classify.RequestCategory;
import com.mk.fx.qa.load.contention.model.ResourceStatus;
import com.mk.fx.qa.load.contention.model.UpdateType;
import com.mk.fx.qa.load.contention.partition.IdPartitioner;
import com.mk.fx.qa.load.contention.partition.WorkerPartition;
import com.mk.fx.qa.load.contention.rest.HttpMethod;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.rest.TransportException;
import com.mk.fx.qa.load.contention.store.VersionedResourceStore;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ConflictRetryStateMachineTest {

  private static final ResourceEndpoints ENDPOINTS = ResourceEndpoints.defaults();
  private static final WorkerPartition WHOLE_POOL = new WorkerPartition(0, 0, 4, false);

  private final VersionedResourceStore store = new VersionedResourceStore(List.of("a", "b", "c", "d"));

  private static RestResponseData response(int status, String body) {
    return new RestResponseData(status, Map.of(), body, 1L);
  }

  private static RetryPolicy fixed(int retryCount) {
    return new RetryPolicy(retryCount, 2, 16, BackoffPolicy.FIXED);
  }

  private ConflictRetryStateMachine fieldMachine(RetryPolicy policy) {
    return new ConflictRetryStateMachine(
        WHOLE_POOL,
        store,
        new FieldUpdateVariant(List.of(UpdateType.PRIORITY)),
        policy,
        ENDPOINTS,
        new Random(7));
  }

  private static PlannedRequest answer(ConflictRetryStateMachine machine, int status, String body) {
    var planned = machine.nextRequest();
    machine.onResponse(response(status, body));
    return planned;
  }

  /** Answers every backoff placeholder with a healthy response and returns how many there were. */
  private static int drainBackoff(ConflictRetryStateMachine machine) {
    int skipped = 0;
    while (machine.nextCycleExcluded()) {
      var planned = answer(machine, 200, "{\"status\":\"ok\"}");
      assertEquals(RequestCategory.BACKOFF, planned.category());
      assertEquals("/health", planned.request().getPath());
      skipped++;
    }
    return skipped;
  }

  private static Object bodyField(PlannedRequest planned, String field) {
    return ((Map<?, ?>) planned.request().getBody()).get(field);
  }

  @Test
  void firstUpdate_targetsSecondIdOfRange_withLocalVersion() {
    var machine = fieldMachine(fixed(0));

    var planned = machine.nextRequest();

    assertEquals(RequestCategory.EXECUTED, planned.category());
    assertEquals(HttpMethod.PUT, planned.request().getMethod());
    assertEquals("/tasks/b", planned.request().getPath());
    assertEquals("PUT /tasks/{id}", planned.endpoint());
    assertEquals(1L, bodyField(planned, "version"));
  }

  @Test
  void successfulUpdate_incrementsLocalVersion() throws Exception {
    var machine = fieldMachine(fixed(0));

    answer(machine, 200, "{}");

    assertEquals(2L, store.getState(2).version());
    assertEquals(MachineState.UPDATE, machine.state());
  }

  @Test
  void retriesDisabled_conflictIsExhaustedImmediately_withoutRefresh() {
    var machine = fieldMachine(fixed(0));

    answer(machine, 409, "{\"error\":\"version mismatch\"}");

    var report = machine.report();
    assertEquals(1, report.exhaustedRetries());
    assertEquals(1, report.conflicts());
    assertEquals(MachineState.UPDATE, machine.state());
    assertTrue(machine.retrySession().isEmpty());
    assertEquals(0, machine.remainingBackoff());

    var next = machine.nextRequest();
    assertEquals(HttpMethod.PUT, next.request().getMethod());
    assertEquals("/tasks/c", next.request().getPath());
  }

  @Test
  void retryCountThree_exhaustsAfterThreeConflictedResends_withExponentialBackoff() {
    var machine = fieldMachine(fixed(3));

    var update = answer(machine, 409, "{}");
    assertEquals("/tasks/b", update.request().getPath());
    assertEquals(MachineState.RETRY_GET, machine.state());

    int[] expectedSkips = {1, 2, 4};
    for (int attempt = 0; attempt < 3; attempt++) {
      assertEquals(expectedSkips[attempt], drainBackoff(machine));

      var refresh = answer(machine, 200, "{\"id\":\"b\",\"version\":" + (10 + attempt) + "}");
      assertEquals(HttpMethod.GET, refresh.request().getMethod());
      assertEquals("/tasks/b", refresh.request().getPath());
      assertEquals("GET /tasks/{id}", refresh.endpoint());
      assertEquals(MachineState.RETRY_WRITE, machine.state());

      var resend = answer(machine, 409, "{}");
      assertEquals(HttpMethod.PUT, resend.request().getMethod());
      assertEquals((long) (10 + attempt), bodyField(resend, "version"));
    }

    var report = machine.report();
    assertEquals(1, report.exhaustedRetries());
    assertEquals(0, report.successfulRetries());
    assertEquals(4, report.conflicts());
    assertEquals(7, report.categories().executed());
    assertEquals(7, report.categories().backoff());
    assertEquals(MachineState.UPDATE, machine.state());
    assertTrue(machine.retrySession().isEmpty());
  }

  @Test
  void successfulResend_countsRetryAndAdvancesFromServerVersion() throws Exception {
    var machine = fieldMachine(fixed(2));

    answer(machine, 409, "{}");
    drainBackoff(machine);
    answer(machine, 200, "{\"id\":\"b\",\"version\":9,\"title\":\"x\"}");
    var resend = answer(machine, 200, "{}");

    assertEquals(9L, bodyField(resend, "version"));
    assertEquals(1, machine.report().successfulRetries());
    assertEquals(10L, store.getState(2).version());
    assertEquals(MachineState.UPDATE, machine.state());
  }

  @Test
  void malformedRefreshBody_abandonsRetry() {
    var machine = fieldMachine(fixed(2));

    answer(machine, 409, "{}");
    drainBackoff(machine);
    answer(machine, 200, "not json");

    assertEquals(MachineState.UPDATE, machine.state());
    assertTrue(machine.retrySession().isEmpty());
    assertEquals(0, machine.report().exhaustedRetries());
  }

  @Test
  void transportFailureDuringRetry_resetsAndKeepsCategoryBalance() {
    var machine = fieldMachine(fixed(2));

    answer(machine, 409, "{}");
    drainBackoff(machine);
    machine.nextRequest();
    machine.onTransportFailure(new TransportException("connection reset", null));

    assertEquals(MachineState.UPDATE, machine.state());
    assertTrue(machine.retrySession().isEmpty());
    assertFalse(machine.classifier().hasPending());
    assertEquals(1, machine.report().transportFailures());
    assertEquals(3, machine.report().categories().sum());
  }

  @Test
  void transportFailureOnBackoffPlaceholder_keepsRetryInProgress() {
    var machine = fieldMachine(fixed(3));

    answer(machine, 409, "{}");
    var placeholder = machine.nextRequest();
    assertEquals(RequestCategory.BACKOFF, placeholder.category());
    machine.onTransportFailure(new TransportException("health check timed out", null));

    assertEquals(MachineState.RETRY_GET, machine.state());
    assertTrue(machine.retrySession().isPresent());
    assertEquals(1, machine.report().transportFailures());
    assertFalse(machine.classifier().hasPending());

    var refresh = machine.nextRequest();
    assertEquals(HttpMethod.GET, refresh.request().getMethod());
    assertEquals("/tasks/b", refresh.request().getPath());
  }

  @Test
  void opaqueIds_areSentAsEncodedPathSegments() {
    var spaced = new VersionedResourceStore(List.of("task 0", "task 1"));
    var machine =
        new ConflictRetryStateMachine(
            new WorkerPartition(0, 0, 2, false),
            spaced,
            new StatusTransitionVariant(),
            fixed(0),
            ENDPOINTS,
            new Random(7));

    var planned = machine.nextRequest();

    assertEquals("/tasks/task%201/status", planned.request().getPath());
    assertEquals("PATCH /tasks/{id}/status", planned.endpoint());
  }

  @Test
  void hardError_isNotRetried() {
    var machine = fieldMachine(fixed(3));

    answer(machine, 500, "boom");

    assertEquals(MachineState.UPDATE, machine.state());
    assertEquals(0, machine.report().conflicts());
    assertEquals(0, machine.remainingBackoff());
  }

  @Test
  void statusVariant_skipsTerminalResources() throws Exception {
    var twoIds = new VersionedResourceStore(List.of("a", "b"));
    twoIds.setVersionAndStatus(2, 3, ResourceStatus.CANCELLED);
    var machine =
        new ConflictRetryStateMachine(
            new WorkerPartition(0, 0, 2, false),
            twoIds,
            new StatusTransitionVariant(),
            fixed(1),
            ENDPOINTS,
            new Random(1));

    var planned = machine.nextRequest();

    assertEquals(HttpMethod.PATCH, planned.request().getMethod());
    assertEquals("/tasks/a/status", planned.request().getPath());
    assertEquals("PATCH /tasks/{id}/status", planned.endpoint());
  }

  @Test
  void statusVariant_successfulTransitionTracksNewStatus() throws Exception {
    var machine =
        new ConflictRetryStateMachine(
            WHOLE_POOL, store, new StatusTransitionVariant(), fixed(1), ENDPOINTS, new Random(3));

    var planned = answer(machine, 200, "{}");

    var next = ResourceStatus.fromWire((String) bodyField(planned, "status")).orElseThrow();
    assertThat(StatusTransitions.allowedFrom(ResourceStatus.PENDING)).contains(next);
    assertEquals(2L, store.getState(2).version());
    assertEquals(next, store.getState(2).status());
  }

  @Test
  void statusVariant_allTerminal_fallsBackToHealthCheck() throws Exception {
    var oneId = new VersionedResourceStore(List.of("a"));
    oneId.setVersionAndStatus(1, 4, ResourceStatus.CANCELLED);
    var machine =
        new ConflictRetryStateMachine(
            new WorkerPartition(0, 0, 1, false),
            oneId,
            new StatusTransitionVariant(),
            fixed(1),
            ENDPOINTS,
            new Random(1));

    var planned = answer(machine, 200, "{}");

    assertEquals(RequestCategory.FALLBACK, planned.category());
    assertEquals("GET /health", planned.endpoint());
    assertEquals(MachineState.FALLBACK, machine.state());
    assertEquals(RequestCategory.FALLBACK, answer(machine, 200, "{}").category());
    assertEquals(2, machine.report().categories().fallback());
  }

  @Test
  void statusVariant_refreshToTerminal_endsRetryWithoutResend() throws Exception {
    var machine =
        new ConflictRetryStateMachine(
            WHOLE_POOL, store, new StatusTransitionVariant(), fixed(2), ENDPOINTS, new Random(5));

    answer(machine, 409, "{}");
    drainBackoff(machine);
    answer(machine, 200, "{\"id\":\"b\",\"version\":6,\"status\":\"cancelled\"}");

    assertEquals(MachineState.UPDATE, machine.state());
    assertEquals(6L, store.getState(2).version());
    assertEquals(ResourceStatus.CANCELLED, store.getState(2).status());
  }

  @Test
  void suppressedWorker_onlySendsPlaceholders() {
    var partition = new IdPartitioner(1, 2).partitionFor(1);
    var machine =
        new ConflictRetryStateMachine(
            partition,
            new VersionedResourceStore(List.of("a")),
            new FieldUpdateVariant(List.of(UpdateType.FULL)),
            fixed(3),
            ENDPOINTS,
            new Random(1));

    for (int i = 0; i < 5; i++) {
      assertTrue(machine.nextCycleExcluded());
      var planned = answer(machine, 200, "{}");
      assertEquals(RequestCategory.SUPPRESSED, planned.category());
      assertEquals("/health", planned.request().getPath());
    }

    var report = machine.report();
    assertTrue(report.suppressed());
    assertEquals(5, report.categories().suppressed());
    assertEquals(0, report.categories().executed());
  }

  @Test
  void categorySum_matchesCyclesUnderRandomConflicts() {
    var machine =
        new ConflictRetryStateMachine(
            WHOLE_POOL,
            store,
            new FieldUpdateVariant(List.of(UpdateType.values())),
            new RetryPolicy(2, 2, 8, BackoffPolicy.FULL_JITTER),
            ENDPOINTS,
            new Random(11));
    var outcomes = new Random(42);

    int cycles = 500;
    for (int i = 0; i < cycles; i++) {
      var planned = machine.nextRequest();
      if (planned.request().getMethod() == HttpMethod.GET
          && planned.category() == RequestCategory.EXECUTED) {
        machine.onResponse(response(200, "{\"version\":" + (i + 1) + "}"));
      } else if (outcomes.nextInt(10) < 4) {
        machine.onResponse(response(409, "{}"));
      } else {
        machine.onResponse(response(200, "{}"));
      }
    }

    var categories = machine.report().categories();
    assertEquals(cycles, categories.sum());
    assertEquals(cycles, categories.requestsIssued());
    assertThat(categories.backoff()).isPositive();
  }
}
