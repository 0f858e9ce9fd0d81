package com.mk.fx.qa.load.contention.partition;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits the id pool into contiguous, non-overlapping slices, one per worker.
 *
 * <p>{@code rangeSize = floor(poolSize / workers)}, so trailing ids are never targeted when the
 * pool is not an exact multiple of the worker count. When there are more workers than ids, the
 * worker count is clamped to the pool size and every worker with {@code index >= poolSize} is
 * suppressed. Non-positive inputs fall back to the defaults with a warning.
 */
@Slf4j
public class IdPartitioner {

  public static final int DEFAULT_WORKER_COUNT = 1;
  public static final int DEFAULT_POOL_SIZE = 10;

  @Getter private final int poolSize;
  @Getter private final int workerCount;
  @Getter private final int effectiveWorkerCount;

  public IdPartitioner(int poolSize, int workerCount) {
    this.poolSize = orDefault(poolSize, DEFAULT_POOL_SIZE, "pool size");
    this.workerCount = orDefault(workerCount, DEFAULT_WORKER_COUNT, "worker count");
    if (this.poolSize < this.workerCount) {
      log.warn(
          "Pool size ({}) < worker count ({}), using {} active workers; the rest are suppressed",
          this.poolSize,
          this.workerCount,
          this.poolSize);
      this.effectiveWorkerCount = this.poolSize;
    } else {
      this.effectiveWorkerCount = this.workerCount;
    }
  }

  /** Computes the partition for {@code workerIndex} in {@code [0, workerCount)}. */
  public WorkerPartition partitionFor(int workerIndex) {
    if (workerIndex < 0 || workerIndex >= workerCount) {
      throw new IllegalArgumentException(
          "workerIndex " + workerIndex + " outside [0, " + workerCount + ")");
    }
    if (workerIndex >= poolSize) {
      log.info("Worker {} suppressed (pool size {})", workerIndex, poolSize);
      return WorkerPartition.suppressed(workerIndex);
    }
    int rangeSize = poolSize / effectiveWorkerCount;
    var partition = new WorkerPartition(workerIndex, workerIndex * rangeSize, rangeSize, false);
    log.info(
        "Worker {} id range: {}-{} ({} ids)",
        workerIndex,
        partition.startIndex(),
        partition.endIndex(),
        rangeSize);
    return partition;
  }

  public List<WorkerPartition> partitionAll() {
    List<WorkerPartition> partitions = new ArrayList<>(workerCount);
    for (int i = 0; i < workerCount; i++) {
      partitions.add(partitionFor(i));
    }
    return partitions;
  }

  public int suppressedWorkerCount() {
    return Math.max(0, workerCount - poolSize);
  }

  private static int orDefault(int value, int fallback, String name) {
    if (value < 1) {
      log.warn("Invalid {} {}, defaulting to {}", name, value, fallback);
      return fallback;
    }
    return value;
  }
}
