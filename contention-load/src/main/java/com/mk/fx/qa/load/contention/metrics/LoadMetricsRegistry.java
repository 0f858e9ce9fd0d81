package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Live metrics of running tasks, final snapshots of finished ones, and their reports.
 */
@Component
public class LoadMetricsRegistry {

  private final Map<UUID, LoadMetrics> active = new ConcurrentHashMap<>();
  private final Map<UUID, LoadSnapshot> completed = new ConcurrentHashMap<>();
  private final Map<UUID, ContentionRunReport> reports = new ConcurrentHashMap<>();

  public void register(UUID taskId, LoadMetrics metrics) {
    active.put(taskId, metrics);
  }

  /** Keeps the final snapshot and drops the live metrics. */
  public void complete(UUID taskId, LoadSnapshot finalSnapshot) {
    completed.put(taskId, finalSnapshot);
    active.remove(taskId);
  }

  /** Live snapshot while running, the final one afterwards. */
  public Optional<LoadSnapshot> getSnapshot(UUID taskId) {
    LoadMetrics m = active.get(taskId);
    if (m != null) {
      return Optional.of(m.snapshotNow());
    }
    return Optional.ofNullable(completed.get(taskId));
  }

  public void saveReport(UUID taskId, ContentionRunReport report) {
    reports.put(taskId, report);
  }

  public Optional<ContentionRunReport> getReport(UUID taskId) {
    return Optional.ofNullable(reports.get(taskId));
  }

  /** Forgets everything about a task evicted from history. */
  public void evict(UUID taskId) {
    active.remove(taskId);
    completed.remove(taskId);
    reports.remove(taskId);
  }
}
