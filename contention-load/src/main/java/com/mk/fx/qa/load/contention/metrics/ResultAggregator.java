package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.classify.CategoryCounts;
import com.mk.fx.qa.load.contention.conflict.WorkerReport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds per-worker reports into run totals and checks each worker's category sum against the
 * number of requests it actually completed.
 */
@Slf4j
public class ResultAggregator {

  private final List<Entry> entries = new ArrayList<>();

  /** A worker's report with the completed-request count observed for it. */
  public record Entry(WorkerReport report, long completedRequests) {}

  public synchronized void add(WorkerReport report, long completedRequests) {
    entries.add(new Entry(report, completedRequests));
  }

  public synchronized List<Entry> entries() {
    var sorted = new ArrayList<>(entries);
    sorted.sort(Comparator.comparingInt(e -> e.report().workerIndex()));
    return List.copyOf(sorted);
  }

  public synchronized CategoryCounts categories() {
    var total = CategoryCounts.ZERO;
    for (Entry e : entries) {
      total = total.plus(e.report().categories());
    }
    return total;
  }

  public synchronized long successfulRetries() {
    return entries.stream().mapToLong(e -> e.report().successfulRetries()).sum();
  }

  public synchronized long exhaustedRetries() {
    return entries.stream().mapToLong(e -> e.report().exhaustedRetries()).sum();
  }

  public synchronized long conflicts() {
    return entries.stream().mapToLong(e -> e.report().conflicts()).sum();
  }

  public synchronized long completedRequests() {
    return entries.stream().mapToLong(Entry::completedRequests).sum();
  }

  /** One message per worker whose category sum differs from its completed requests. */
  public synchronized List<String> consistencyWarnings() {
    List<String> warnings = new ArrayList<>();
    for (Entry e : entries()) {
      long sum = e.report().categories().sum();
      if (sum != e.completedRequests()) {
        var message =
            String.format(
                "worker %d: completed=%d, sum(categories)=%d",
                e.report().workerIndex(), e.completedRequests(), sum);
        log.warn("Inconsistency detected, {}", message);
        warnings.add(message);
      }
    }
    return List.copyOf(warnings);
  }
}
