package com.mk.fx.qa.load.contention.dto.controllerresponse;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Live view of a running or finished contention task: its fixed configuration plus the counters
 * so far. Category counts include requests classified but not yet answered.
 */
@Data
@Builder
public class TaskLiveMetricsResponse {

  private String taskId;
  private String taskType;
  private String baseUrl;
  private int workersRequested;
  private int workersEffective;
  private int suppressedWorkers;
  private int idPoolSize;
  private long cyclesPerWorker;
  private Duration warmup;
  private Duration rampUp;
  private Duration duration;
  private Double ratePerWorker;
  private Double expectedRps;

  private long completedRequests;
  private long executed;
  private long backoff;
  private long suppressed;
  private long fallback;
  private long successfulRetries;
  private long exhaustedRetries;
  private long conflicts;
  private long totalErrors;
  private Double achievedRps;
  private Long latencyMinMs;
  private Long latencyAvgMs;
  private Long latencyMaxMs;
}
