package com.mk.fx.qa.load.contention.executors.closed;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Fixed-rate slot scheduler for one worker. Slots are laid out from the first call, so a worker that
 * falls behind catches up without sleeping rather than drifting.
 */
public final class CyclePacer {

  private static final long SLEEP_CHUNK_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

  private final long intervalNanos;
  private final BooleanSupplier stopRequested;
  private long nextSlotNanos = -1;

  private CyclePacer(long intervalNanos, BooleanSupplier stopRequested) {
    this.intervalNanos = intervalNanos;
    this.stopRequested = stopRequested;
  }

  /** A pacer that never waits. */
  public static CyclePacer unpaced() {
    return new CyclePacer(0, () -> false);
  }

  public static CyclePacer of(Double ratePerSecond, BooleanSupplier stopRequested) {
    if (ratePerSecond == null || ratePerSecond <= 0) {
      return unpaced();
    }
    return new CyclePacer((long) (TimeUnit.SECONDS.toNanos(1) / ratePerSecond), stopRequested);
  }

  public boolean paced() {
    return intervalNanos > 0;
  }

  /**
   * Blocks until the next slot is due.
   *
   * @throws InterruptedException if interrupted or a stop is requested while waiting
   */
  public void awaitSlot() throws InterruptedException {
    if (!paced()) {
      return;
    }
    long now = System.nanoTime();
    if (nextSlotNanos < 0) {
      nextSlotNanos = now;
    }
    while (true) {
      long remaining = nextSlotNanos - System.nanoTime();
      if (remaining <= 0) {
        break;
      }
      if (stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Stopped while waiting for a paced slot");
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(remaining, SLEEP_CHUNK_NANOS));
    }
    nextSlotNanos += intervalNanos;
  }
}
