package com.mk.fx.qa.load.contention.partition;

/**
 * Slice of the id pool assigned to one worker.
 *
 * @param workerIndex zero-based worker index
 * @param startIndex zero-based offset of the first id in the slice
 * @param rangeSize number of ids in the slice; 0 when suppressed
 * @param suppressed true when the worker has no ids and may only issue fallback requests
 */
public record WorkerPartition(int workerIndex, int startIndex, int rangeSize, boolean suppressed) {

  static WorkerPartition suppressed(int workerIndex) {
    return new WorkerPartition(workerIndex, 0, 0, true);
  }

  /**
   * Maps a cycle counter to a 1-based store index inside this slice, round-robin.
   *
   * @throws IllegalStateException if the partition is suppressed
   */
  public int indexFor(long counter) {
    if (suppressed) {
      throw new IllegalStateException("Worker " + workerIndex + " is suppressed and owns no ids");
    }
    return startIndex + (int) Math.floorMod(counter, (long) rangeSize) + 1;
  }

  /** Zero-based inclusive end offset, for logging. */
  public int endIndex() {
    return startIndex + rangeSize - 1;
  }
}
