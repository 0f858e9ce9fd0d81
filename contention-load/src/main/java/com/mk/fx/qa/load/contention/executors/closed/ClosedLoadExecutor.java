package com.mk.fx.qa.load.contention.executors.closed;

import static com.mk.fx.qa.load.contention.utils.LoadUtils.toDuration;
import static java.util.concurrent.Executors.newFixedThreadPool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed set of workers, one thread each, until every worker has done its cycles, the
 * wall-clock bound passes or the run is cancelled. Each worker is strictly sequential: cycle {@code
 * k} finishes before cycle {@code k + 1} starts.
 *
 * <p>Ramp-up spreads worker starts evenly; warmup delays the first start.
 */
@Slf4j
public final class ClosedLoadExecutor {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private ClosedLoadExecutor() {
    throw new UnsupportedOperationException("ClosedLoadExecutor cannot be instantiated");
  }

  /**
   * Runs a closed-model execution.
   *
   * @param taskId task identifier used for thread names and logs
   * @param parameters workers, cycles and timing
   * @param cancellationRequested checked for cooperative cancellation
   * @param cycleRunner invoked once per worker cycle
   * @return totals and the reason the run stopped
   * @throws Exception if interrupted while coordinating workers
   */
  public static ClosedLoadResult execute(
      UUID taskId,
      ClosedLoadParameters parameters,
      BooleanSupplier cancellationRequested,
      WorkerCycleRunner cycleRunner)
      throws Exception {
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    Objects.requireNonNull(cycleRunner, "cycleRunner");

    var workers = Math.max(1, parameters.workers());
    var cycles = parameters.unboundedCycles() ? Long.MAX_VALUE : parameters.cyclesPerWorker();
    var warmup = toDuration(parameters.warmup());
    var rampUp = toDuration(parameters.rampUp());
    var duration = toDuration(parameters.duration());
    if (parameters.unboundedCycles() && duration.isZero()) {
      throw new IllegalArgumentException("An unbounded run needs a duration");
    }

    var cancellationObserved = new AtomicBoolean(false);
    var durationExpired = new AtomicBoolean(false);
    var completedWorkers = new AtomicInteger();

    if (!warmup.isZero()) {
      log.info("Task {} entering warmup for {}", taskId, warmup);
      sleepWithCancellation(warmup, cancellationRequested, cancellationObserved);
      log.info("Task {} completed warmup", taskId);
    }

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("contention-worker-" + taskId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    List<Future<?>> futures = new ArrayList<>();

    var deadline = duration.isZero() ? Long.MAX_VALUE : System.nanoTime() + duration.toNanos();
    var rampIntervalMillis = computeRampIntervalMillis(workers, rampUp);

    try {
      log.info("Task {} starting {} workers over {}", taskId, workers, rampUp);
      for (int workerIndex = 0; workerIndex < workers; workerIndex++) {
        if (shouldStop(cancellationRequested, cancellationObserved) || isExpired(deadline)) {
          durationExpired.compareAndSet(false, isExpired(deadline));
          log.info(
              "Task {} stopping ramp-up at worker {} due to {}",
              taskId,
              workerIndex,
              durationExpired.get() ? "duration expiry" : "cancellation");
          break;
        }

        final var current = workerIndex;
        final var pacer =
            CyclePacer.of(
                parameters.ratePerWorker(),
                () -> cancellationRequested.getAsBoolean() || isExpired(deadline));
        futures.add(
            executor.submit(
                () ->
                    runWorker(
                        taskId,
                        workers,
                        current,
                        cycles,
                        deadline,
                        pacer,
                        cancellationRequested,
                        cancellationObserved,
                        durationExpired,
                        completedWorkers,
                        cycleRunner)));

        if (workerIndex < workers - 1 && rampIntervalMillis > 0) {
          sleepWithCancellation(
              Duration.ofMillis((long) rampIntervalMillis),
              cancellationRequested,
              cancellationObserved);
        }
      }

      log.info("Task {} all workers started, awaiting completion", taskId);
      waitForWorkers(
          futures, deadline, cancellationRequested, cancellationObserved, durationExpired, taskId);
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(30, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    return new ClosedLoadResult(
        workers, completedWorkers.get(), cancellationObserved.get(), durationExpired.get());
  }

  private static void runWorker(
      UUID taskId,
      int totalWorkers,
      int workerIndex,
      long cycles,
      long deadline,
      CyclePacer pacer,
      BooleanSupplier cancellationRequested,
      AtomicBoolean cancellationObserved,
      AtomicBoolean durationExpired,
      AtomicInteger completedWorkers,
      WorkerCycleRunner cycleRunner) {
    log.debug("Task {} worker {} started", taskId, workerIndex);
    long cycle = 0;

    for (; cycle < cycles; cycle++) {
      // Deadline first: workers are interrupted when it passes, which is not a cancellation.
      if (isExpired(deadline)) {
        durationExpired.set(true);
        log.debug("Task {} worker {} reached the deadline after {} cycles", taskId, workerIndex, cycle);
        return;
      }
      if (shouldStop(cancellationRequested, cancellationObserved)) {
        log.info("Task {} worker {} stopping on cancellation after {} cycles", taskId, workerIndex, cycle);
        return;
      }

      try {
        cycleRunner.run(workerIndex, cycle, pacer);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (isExpired(deadline)) {
          durationExpired.set(true);
        }
        log.debug("Task {} worker {} interrupted at cycle {}", taskId, workerIndex, cycle);
        return;
      } catch (Exception ex) {
        log.error(
            "Task {} worker {} cycle {} failed: {} - stopping this worker",
            taskId,
            workerIndex,
            cycle,
            ex.getMessage(),
            ex);
        return;
      }
    }

    var done = completedWorkers.incrementAndGet();
    log.info(
        "Task {} worker {} completed {} cycles (workers completed {}/{})",
        taskId,
        workerIndex,
        cycle,
        done,
        totalWorkers);
  }

  private static void waitForWorkers(
      List<Future<?>> futures,
      long deadline,
      BooleanSupplier cancellationRequested,
      AtomicBoolean cancellationObserved,
      AtomicBoolean durationExpired,
      UUID taskId)
      throws Exception {
    for (Future<?> future : futures) {
      try {
        while (!future.isDone()) {
          if (shouldStop(cancellationRequested, cancellationObserved)) {
            future.cancel(true);
            break;
          }
          if (isExpired(deadline)) {
            durationExpired.set(true);
            future.cancel(true);
            break;
          }
          try {
            future.get(SLEEP_CHUNK_MILLIS, TimeUnit.MILLISECONDS);
          } catch (TimeoutException stillRunning) {
            log.trace("Task {} worker still running", taskId);
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      } catch (CancellationException cancelled) {
        log.debug("Task {} worker future cancelled", taskId);
      }
    }
  }

  private static boolean shouldStop(BooleanSupplier cancelled, AtomicBoolean cancellationObserved) {
    var requested = Thread.currentThread().isInterrupted() || cancelled.getAsBoolean();
    if (requested) {
      cancellationObserved.set(true);
    }
    return requested;
  }

  private static boolean isExpired(long deadline) {
    return System.nanoTime() >= deadline;
  }

  private static double computeRampIntervalMillis(int workers, Duration rampUp) {
    if (workers <= 1 || rampUp.isZero()) {
      return 0;
    }
    return rampUp.toMillis() / (double) (workers - 1);
  }

  private static void sleepWithCancellation(
      Duration duration, BooleanSupplier cancellationRequested, AtomicBoolean cancellationObserved)
      throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0) {
      if (shouldStop(cancellationRequested, cancellationObserved)) {
        throw new InterruptedException("Cancelled during sleep");
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
  }
}
