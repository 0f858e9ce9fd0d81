package com.mk.fx.qa.load.contention.dto.controllerresponse;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Final report of a contention run: request categories, retry outcomes, per-worker totals, status
 * distribution and the store as the generator last saw it.
 */
public class ContentionRunReport {

  public String taskId;
  public String taskType;
  public Instant startTime;
  public Instant endTime;
  public double durationSec;

  public EnvInfo environment;
  public Config config;
  public Categories categories;
  public Retries retries;
  public Metrics metrics;
  public List<WorkerEntry> workers;
  public StatusDistribution statusDistribution;
  public List<StoreEntry> store;
  public List<String> consistencyWarnings;
  public Completion completion;
  public Summary summary;

  public static class EnvInfo {
    public String host;
    public String triggeredBy;
  }

  public static class Config {
    public String baseUrl;
    public int workersRequested;
    public int workersEffective;
    public int suppressedWorkers;
    public int idPoolSize;
    public long cyclesPerWorker;
    public Duration warmup;
    public Duration rampUp;
    public Duration duration;
    public Double ratePerWorker;
    public int retryCount;
    public int backoffBase;
    public int backoffMax;
    public String backoffPolicy;
    public List<String> updateTypes;
    public boolean countExcludedInRate;
    public List<String> defaultedSettings;
  }

  public static class Categories {
    public long executed;
    public long backoff;
    public long suppressed;
    public long fallback;
    public long requestsIssued;
    public long excluded;
  }

  public static class Retries {
    public long conflicts;
    public long successful;
    public long exhausted;
  }

  public static class Metrics {
    public long completedRequests;
    public long executedResponses;
    public long transportFailures;
    public long httpErrors;
    /** 4xx, 5xx and unbucketed statuses over executed responses. */
    public double actualErrorRate;
    public double achievedRps;
    public Latency latency;
    public List<ErrorItem> errorBreakdown;
    public List<ErrorSample> errorSamples;
  }

  public static class Latency {
    public long min;
    public Long avg;
    public long max;
    public Long p95;
    public Long p99;
  }

  public static class ErrorItem {
    public String type;
    public long count;
  }

  @NoArgsConstructor
  @AllArgsConstructor
  public static class ErrorSample {
    public String type;
    public String message;
    public List<String> stack;
  }

  public static class WorkerEntry {
    public int workerIndex;
    public boolean suppressed;
    public long executed;
    public long backoff;
    public long suppressedRequests;
    public long fallback;
    public long requestsIssued;
    public long completedRequests;
    public long successfulRetries;
    public long exhaustedRetries;
    public long conflicts;
    public long transportFailures;
  }

  public static class StatusDistribution {
    /** Bucket label to count across all endpoints, in bucket order. */
    public Map<String, Long> overall;
    public List<EndpointStatus> endpoints;
  }

  public static class EndpointStatus {
    public String endpoint;
    public long total;
    public Map<String, Long> buckets;
    public Latency latency;
  }

  public static class StoreEntry {
    public String id;
    public long version;
    public String status;
  }

  public static class Completion {
    public String reason; // ALL_WORKERS_FINISHED, DURATION_EXPIRED, CANCELLED, ERROR
    public int totalWorkers;
    public int completedWorkers;
    public String message;
  }

  public static class Summary {
    public String status; // CONSISTENT, INCONSISTENT
    public String message;
    public List<String> highlights;
    public List<String> concerns;
  }
}
