package com.mk.fx.qa.load.contention.executors.closed;

/**
 * Callback used by {@link ClosedLoadExecutor} to perform one cycle of one worker. Throwing ends
 * that worker; the others continue.
 */
@FunctionalInterface
public interface WorkerCycleRunner {

  /**
   * @param workerIndex zero-based worker index
   * @param cycle zero-based cycle counter for that worker
   * @param pacer the worker's pacer; the runner decides whether the cycle takes a paced slot
   */
  void run(int workerIndex, long cycle, CyclePacer pacer) throws Exception;
}
