package com.mk.fx.qa.load.contention.processors.conflict;

import com.mk.fx.qa.load.contention.conflict.ConflictRetryStateMachine;
import com.mk.fx.qa.load.contention.executors.closed.CyclePacer;
import com.mk.fx.qa.load.contention.metrics.LoadMetrics;
import com.mk.fx.qa.load.contention.rest.RestResponseData;
import com.mk.fx.qa.load.contention.rest.TransportException;

/**
 * One worker's cycle: pace, plan, send, feed the outcome back to the state machine and metrics.
 * Every classified request ends in exactly one of response, transport failure or abandonment.
 */
public class ConflictWorker {

  private final ConflictRetryStateMachine machine;
  private final RequestSender sender;
  private final LoadMetrics metrics;
  private final boolean countExcludedInRate;

  public ConflictWorker(
      ConflictRetryStateMachine machine,
      RequestSender sender,
      LoadMetrics metrics,
      boolean countExcludedInRate) {
    this.machine = machine;
    this.sender = sender;
    this.metrics = metrics;
    this.countExcludedInRate = countExcludedInRate;
  }

  public void runCycle(CyclePacer pacer) throws InterruptedException {
    if (countExcludedInRate || !machine.nextCycleExcluded()) {
      pacer.awaitSlot();
    }
    int workerIndex = machine.partition().workerIndex();
    var planned = machine.nextRequest();

    RestResponseData response;
    try {
      response = sender.send(planned.request());
    } catch (TransportException e) {
      if (Thread.currentThread().isInterrupted()) {
        machine.onAbandoned();
        metrics.recordAbandoned(workerIndex);
        throw new InterruptedException("Worker " + workerIndex + " interrupted mid-request");
      }
      machine.onTransportFailure(e);
      metrics.recordTransportFailure(workerIndex, planned, e);
      return;
    }
    machine.onResponse(response);
    metrics.recordResponse(workerIndex, planned, response);
  }

  public ConflictRetryStateMachine machine() {
    return machine;
  }
}
