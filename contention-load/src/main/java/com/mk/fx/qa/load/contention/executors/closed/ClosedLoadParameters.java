package com.mk.fx.qa.load.contention.executors.closed;

import java.time.Duration;

/**
 * Parameters for a closed-model run: a fixed set of workers, each issuing cycles back to back.
 *
 * @param workers number of worker threads
 * @param cyclesPerWorker cycles each worker performs; 0 means unbounded, stopped by {@code duration}
 * @param warmup idle period before the first worker starts
 * @param rampUp period over which worker starts are spread
 * @param duration wall-clock bound measured from the first worker start; zero means none
 * @param ratePerWorker paced cycles per second per worker; null or non-positive means unpaced
 */
public record ClosedLoadParameters(
    int workers,
    long cyclesPerWorker,
    Duration warmup,
    Duration rampUp,
    Duration duration,
    Double ratePerWorker) {

  public boolean unboundedCycles() {
    return cyclesPerWorker <= 0;
  }
}
