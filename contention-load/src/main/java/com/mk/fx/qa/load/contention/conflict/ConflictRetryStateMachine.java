package com.mk.fx.qa.load.contention.conflict;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.contention.classify.RequestCategory;
import com.mk.fx.qa.load.contention.classify.RequestClassifier;
import com.mk.fx.qa.load.contention.partition.WorkerPartition;
import com.mk.fx.qa.load.contention.rest.JsonUtil;
import com.mk.fx.qa.load.contention.rest.Request;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.rest.TransportException;
import com.mk.fx.qa.load.contention.store.ResourceState;
import com.mk.fx.qa.load.contention.store.StoreException;
import com.mk.fx.qa.load.contention.store.VersionedResourceStore;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one worker through optimistic-concurrency updates of its slice of the resource pool.
 *
 * <p>Each cycle the worker calls {@link #nextRequest()}, sends the request, and hands the outcome to
 * {@link #onResponse} or {@link #onTransportFailure}. Priority inside {@code nextRequest}:
 *
 * <ol>
 *   <li>suppressed worker: fallback request, counted as SUPPRESSED
 *   <li>backoff window still open: fallback request, counted as BACKOFF
 *   <li>otherwise dispatch on {@link MachineState}
 * </ol>
 *
 * A 409 on an update opens a {@link RetrySession}: refresh with {@code GET}, resync the store, resend,
 * and repeat on further conflicts until {@link RetryPolicy#retryCount()} resends have conflicted.
 *
 * <p>Not thread-safe: one instance per worker thread. {@link #report()} may be called from any thread.
 */
@Slf4j
public class ConflictRetryStateMachine {

  private final WorkerPartition partition;
  private final VersionedResourceStore store;
  private final UpdateVariant variant;
  private final RetryPolicy policy;
  private final ResourceEndpoints endpoints;
  private final Random random;
  private final RequestClassifier classifier;

  private final AtomicLong successfulRetries = new AtomicLong();
  private final AtomicLong exhaustedRetries = new AtomicLong();
  private final AtomicLong conflicts = new AtomicLong();
  private final AtomicLong transportFailures = new AtomicLong();

  private MachineState state = MachineState.UPDATE;
  private RetrySession session;
  private long counter;
  private int skipCounter;
  private int skipTarget;
  private int lastIndex;
  private UpdateBody lastBody;
  private boolean exhaustedPartitionLogged;

  public ConflictRetryStateMachine(
      WorkerPartition partition,
      VersionedResourceStore store,
      UpdateVariant variant,
      RetryPolicy policy,
      ResourceEndpoints endpoints,
      Random random) {
    this.partition = Objects.requireNonNull(partition, "partition");
    this.store = Objects.requireNonNull(store, "store");
    this.variant = Objects.requireNonNull(variant, "variant");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
    this.random = Objects.requireNonNull(random, "random");
    this.classifier = new RequestClassifier(partition.workerIndex());
  }

  /** Plans and classifies the request for this cycle. */
  public PlannedRequest nextRequest() {
    if (partition.suppressed()) {
      return placeholder(RequestCategory.SUPPRESSED);
    }
    if (skipCounter < skipTarget) {
      skipCounter++;
      return placeholder(RequestCategory.BACKOFF);
    }
    skipCounter = 0;
    skipTarget = 0;

    return switch (state) {
      case RETRY_GET -> retryGet();
      case RETRY_WRITE -> retryWrite();
      case UPDATE, FALLBACK -> update();
    };
  }

  /**
   * True when the next {@link #nextRequest()} is certain to be a suppressed or backoff placeholder.
   * Lets the caller skip pacing before the cycle is classified.
   */
  public boolean nextCycleExcluded() {
    return partition.suppressed() || skipCounter < skipTarget;
  }

  /** Applies the response of the request returned by the last {@link #nextRequest()}. */
  public void onResponse(RestResponseData response) {
    var category = classifier.consume();
    if (category != RequestCategory.EXECUTED) {
      return;
    }
    switch (state) {
      case UPDATE -> onUpdateResponse(response);
      case RETRY_GET -> onRefreshResponse(response);
      case RETRY_WRITE -> onRetryWriteResponse(response);
      case FALLBACK -> {
        // fallback cycles are never EXECUTED
      }
    }
  }

  /**
   * The last request produced no HTTP response. The failure is always counted, but only a failed
   * EXECUTED request abandons the retry in progress; placeholder outcomes never move the machine.
   */
  public void onTransportFailure(TransportException failure) {
    var category = classifier.hasPending() ? classifier.consume() : null;
    transportFailures.incrementAndGet();
    log.warn(
        "Worker {} transport failure on {} request in state {}: {}",
        partition.workerIndex(),
        category,
        state,
        failure.getMessage());
    if (category == RequestCategory.EXECUTED) {
      resetRetry();
    }
  }

  /**
   * The last request was cut short because the run is stopping. Its label is consumed so the
   * category sum still matches completed requests, but no failure is counted.
   */
  public void onAbandoned() {
    if (classifier.hasPending()) {
      classifier.consume();
    }
    resetRetry();
  }

  public WorkerReport report() {
    return new WorkerReport(
        partition.workerIndex(),
        partition.suppressed(),
        classifier.snapshot(),
        successfulRetries.get(),
        exhaustedRetries.get(),
        conflicts.get(),
        transportFailures.get());
  }

  public RequestClassifier classifier() {
    return classifier;
  }

  public WorkerPartition partition() {
    return partition;
  }

  @VisibleForTesting
  MachineState state() {
    return state;
  }

  @VisibleForTesting
  Optional<RetrySession> retrySession() {
    return Optional.ofNullable(session);
  }

  @VisibleForTesting
  int remainingBackoff() {
    return skipTarget - skipCounter;
  }

  private PlannedRequest update() {
    state = MachineState.UPDATE;
    int sweep = Math.max(1, partition.rangeSize());
    for (int attempt = 0; attempt < sweep; attempt++) {
      counter++;
      int index = partition.indexFor(counter);
      ResourceState current;
      try {
        current = store.getState(index);
      } catch (StoreException e) {
        log.warn("Worker {} cannot read index {}: {}", partition.workerIndex(), index, e.getMessage());
        return fallback();
      }
      var body = variant.buildBody(current, counter, random);
      if (body.isPresent()) {
        lastIndex = index;
        lastBody = body.get();
        exhaustedPartitionLogged = false;
        return executed(
            Request.withBody(
                variant.writeMethod(),
                variant.writePath(endpoints, current.id()),
                lastBody.fields()),
            variant.writeEndpoint(endpoints));
      }
    }
    if (!exhaustedPartitionLogged) {
      log.warn(
          "Worker {} found every resource in its range in a terminal state, using fallback",
          partition.workerIndex());
      exhaustedPartitionLogged = true;
    }
    return fallback();
  }

  private PlannedRequest retryGet() {
    if (session == null) {
      log.warn("Worker {} in {} without a retry session", partition.workerIndex(), state);
      return fallback();
    }
    try {
      var id = store.getId(session.getTargetIndex());
      return executed(
          Request.get(endpoints.resource(id)), "GET " + endpoints.resourceTemplate());
    } catch (StoreException e) {
      log.warn("Worker {} cannot resolve retry target: {}", partition.workerIndex(), e.getMessage());
      return fallback();
    }
  }

  private PlannedRequest retryWrite() {
    if (session == null || session.getPendingBody() == null) {
      log.warn("Worker {} in {} without a prepared body", partition.workerIndex(), state);
      return fallback();
    }
    try {
      var id = store.getId(session.getTargetIndex());
      return executed(
          Request.withBody(
              variant.writeMethod(), variant.writePath(endpoints, id), session.getPendingBody().fields()),
          variant.writeEndpoint(endpoints));
    } catch (StoreException e) {
      log.warn("Worker {} cannot resolve retry target: {}", partition.workerIndex(), e.getMessage());
      return fallback();
    }
  }

  private void onUpdateResponse(RestResponseData response) {
    if (response.isSuccessful()) {
      recordWrite(lastIndex, lastBody);
    } else if (response.isConflict()) {
      conflicts.incrementAndGet();
      if (!policy.retriesEnabled()) {
        exhaustedRetries.incrementAndGet();
        log.debug("Worker {} conflict on index {}, retries disabled", partition.workerIndex(), lastIndex);
        resetRetry();
        return;
      }
      session = new RetrySession(lastIndex);
      applyBackoff(session.getAttemptCount());
      state = MachineState.RETRY_GET;
    } else if (response.getStatusCode() >= 400) {
      log.warn(
          "Worker {} update of index {} failed with status {}",
          partition.workerIndex(),
          lastIndex,
          response.getStatusCode());
    }
  }

  private void onRefreshResponse(RestResponseData response) {
    if (!response.isSuccessful()) {
      log.warn(
          "Worker {} refresh failed with status {}", partition.workerIndex(), response.getStatusCode());
      resetRetry();
      return;
    }
    int index = session.getTargetIndex();
    try {
      var local = store.getState(index);
      var refreshed =
          JsonUtil.tryParse(response.getBody(), ResourceSnapshot.class)
              .flatMap(snapshot -> variant.refresh(local, snapshot));
      if (refreshed.isEmpty()) {
        log.warn(
            "Worker {} refresh of {} returned no usable version/status",
            partition.workerIndex(),
            local.id());
        resetRetry();
        return;
      }
      var current = refreshed.get();
      if (variant.tracksStatus()) {
        store.setVersionAndStatus(index, current.version(), current.status());
      } else {
        store.setVersion(index, current.version());
      }
      var body = variant.buildBody(current, index, random);
      if (body.isEmpty()) {
        log.debug("Worker {} retry target {} is now terminal", partition.workerIndex(), local.id());
        resetRetry();
        return;
      }
      session.prepare(body.get());
      state = MachineState.RETRY_WRITE;
    } catch (StoreException e) {
      log.warn("Worker {} failed to resync index {}: {}", partition.workerIndex(), index, e.getMessage());
      resetRetry();
    }
  }

  private void onRetryWriteResponse(RestResponseData response) {
    if (response.isSuccessful()) {
      recordWrite(session.getTargetIndex(), session.getPendingBody());
      successfulRetries.incrementAndGet();
      resetRetry();
    } else if (response.isConflict()) {
      conflicts.incrementAndGet();
      int attempts = session.recordConflict();
      if (attempts >= policy.retryCount()) {
        exhaustedRetries.incrementAndGet();
        log.debug(
            "Worker {} retry exhausted after {} attempts", partition.workerIndex(), attempts);
        resetRetry();
      } else {
        log.debug(
            "Worker {} retry write conflicted (attempt {}/{})",
            partition.workerIndex(),
            attempts,
            policy.retryCount());
        applyBackoff(attempts);
        state = MachineState.RETRY_GET;
      }
    } else {
      log.warn(
          "Worker {} retry write failed with status {}",
          partition.workerIndex(),
          response.getStatusCode());
      resetRetry();
    }
  }

  private void recordWrite(int index, UpdateBody body) {
    try {
      long version = store.incrementVersion(index);
      if (variant.tracksStatus() && body.nextStatus() != null) {
        store.setVersionAndStatus(index, version, body.nextStatus());
      }
    } catch (StoreException e) {
      log.warn(
          "Worker {} failed to record write of index {}: {}",
          partition.workerIndex(),
          index,
          e.getMessage());
    }
  }

  private void applyBackoff(int attempt) {
    skipTarget =
        policy
            .backoffPolicy()
            .skipTarget(attempt, policy.backoffBase(), policy.backoffMax(), random);
    skipCounter = 0;
  }

  private void resetRetry() {
    session = null;
    state = MachineState.UPDATE;
    skipTarget = 0;
    skipCounter = 0;
  }

  private PlannedRequest fallback() {
    resetRetry();
    state = MachineState.FALLBACK;
    classifier.classify(RequestCategory.FALLBACK);
    return new PlannedRequest(
        endpoints.fallbackRequest(), RequestCategory.FALLBACK, fallbackEndpoint());
  }

  private PlannedRequest placeholder(RequestCategory category) {
    classifier.classify(category);
    return new PlannedRequest(endpoints.fallbackRequest(), category, fallbackEndpoint());
  }

  private PlannedRequest executed(Request request, String endpoint) {
    classifier.classify(RequestCategory.EXECUTED);
    return new PlannedRequest(request, RequestCategory.EXECUTED, endpoint);
  }

  private String fallbackEndpoint() {
    return "GET " + endpoints.fallbackPath();
  }
}
