package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * HTTP status distribution of executed requests, per endpoint template. Backoff, suppressed and
 * fallback responses never reach this class.
 */
public class StatusDistribution implements ProtocolMetricsProvider {

  private final Map<String, EndpointStats> endpoints = new ConcurrentHashMap<>();

  public void record(String endpoint, int statusCode, long latencyMs) {
    endpoints.computeIfAbsent(endpoint, EndpointStats::new).record(statusCode, latencyMs);
  }

  public long total() {
    return endpoints.values().stream().mapToLong(EndpointStats::total).sum();
  }

  public long errors() {
    long errors = 0;
    for (EndpointStats stats : endpoints.values()) {
      for (StatusBucket bucket : StatusBucket.values()) {
        if (bucket.isError()) {
          errors += stats.counts.get(bucket.ordinal());
        }
      }
    }
    return errors;
  }

  /** Error buckets over all recorded responses; 0 when nothing was recorded. */
  public double actualErrorRate() {
    long total = total();
    return total == 0 ? 0.0 : (double) errors() / total;
  }

  public Map<StatusBucket, Long> overall() {
    Map<StatusBucket, Long> totals = new EnumMap<>(StatusBucket.class);
    for (StatusBucket bucket : StatusBucket.values()) {
      long sum = 0;
      for (EndpointStats stats : endpoints.values()) {
        sum += stats.counts.get(bucket.ordinal());
      }
      totals.put(bucket, sum);
    }
    return totals;
  }

  @Override
  public void applyTo(ContentionRunReport report) {
    var distribution = new ContentionRunReport.StatusDistribution();
    distribution.overall = labelled(overall());

    List<ContentionRunReport.EndpointStatus> list = new ArrayList<>();
    endpoints.values().stream()
        .sorted(Comparator.comparing(s -> s.endpoint))
        .forEach(
            s -> {
              var es = new ContentionRunReport.EndpointStatus();
              es.endpoint = s.endpoint;
              es.total = s.total();
              Map<StatusBucket, Long> buckets = new EnumMap<>(StatusBucket.class);
              for (StatusBucket bucket : StatusBucket.values()) {
                buckets.put(bucket, s.counts.get(bucket.ordinal()));
              }
              es.buckets = labelled(buckets);
              var latency = new ContentionRunReport.Latency();
              latency.min = s.latency.minMs().orElse(0L);
              latency.avg = s.latency.avgMs().orElse(null);
              latency.max = s.latency.maxMs().orElse(0L);
              latency.p95 = s.latency.p95Ms().orElse(null);
              latency.p99 = s.latency.p99Ms().orElse(null);
              es.latency = latency;
              list.add(es);
            });
    distribution.endpoints = List.copyOf(list);
    report.statusDistribution = distribution;
  }

  private static Map<String, Long> labelled(Map<StatusBucket, Long> counts) {
    Map<String, Long> labelled = new LinkedHashMap<>();
    counts.forEach((bucket, count) -> labelled.put(bucket.label(), count));
    return labelled;
  }

  private static final class EndpointStats {
    final String endpoint;
    final AtomicLongArray counts = new AtomicLongArray(StatusBucket.values().length);
    final LatencyTracker latency = new LatencyTracker(10_000);

    EndpointStats(String endpoint) {
      this.endpoint = endpoint;
    }

    void record(int statusCode, long latencyMs) {
      counts.incrementAndGet(StatusBucket.of(statusCode).ordinal());
      latency.record(latencyMs);
    }

    long total() {
      long sum = 0;
      for (int i = 0; i < counts.length(); i++) {
        sum += counts.get(i);
      }
      return sum;
    }
  }
}
