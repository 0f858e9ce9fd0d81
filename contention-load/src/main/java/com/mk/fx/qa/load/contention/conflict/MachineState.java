package com.mk.fx.qa.load.contention.conflict;

/** Dispatch state of a {@link ConflictRetryStateMachine}. */
public enum MachineState {
  /** Steady state: pick the next id in the partition and send an update. */
  UPDATE,
  /** A conflict is being resolved: re-read the resource. */
  RETRY_GET,
  /** Resend the update with the refreshed version (PUT or PATCH, per variant). */
  RETRY_WRITE,
  /** The previous cycle fell back; the next cycle resets to {@link #UPDATE}. */
  FALLBACK
}
