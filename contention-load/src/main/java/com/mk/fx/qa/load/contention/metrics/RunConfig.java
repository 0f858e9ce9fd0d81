package com.mk.fx.qa.load.contention.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Immutable description of a run, fixed before the first worker starts. Used for log lines and the
 * config section of the report.
 */
public record RunConfig(
    String taskId,
    String taskType,
    String baseUrl,
    int workersRequested,
    int workersEffective,
    int suppressedWorkers,
    int idPoolSize,
    long cyclesPerWorker,
    Duration warmup,
    Duration rampUp,
    Duration duration,
    Double ratePerWorker,
    int retryCount,
    int backoffBase,
    int backoffMax,
    String backoffPolicy,
    List<String> updateTypes,
    boolean countExcludedInRate,
    List<String> defaultedSettings) {

  /** Target cycles per second across all workers, when paced. */
  public Double expectedRps() {
    if (ratePerWorker == null || ratePerWorker <= 0) {
      return null;
    }
    return ratePerWorker * workersRequested;
  }
}
