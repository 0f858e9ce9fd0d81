package com.mk.fx.qa.load.contention.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.contention.classify.CategoryCounts;
import com.mk.fx.qa.load.contention.conflict.WorkerReport;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {

  private static WorkerReport report(int index, CategoryCounts counts, long ok, long exhausted) {
    return new WorkerReport(index, false, counts, ok, exhausted, ok + exhausted, 0);
  }

  @Test
  void totals_sumAcrossWorkers_andEntriesAreOrdered() {
    var aggregator = new ResultAggregator();
    aggregator.add(report(1, new CategoryCounts(4, 1, 0, 0, 5), 1, 0), 5);
    aggregator.add(report(0, new CategoryCounts(6, 2, 0, 1, 9), 0, 2), 9);

    assertEquals(new CategoryCounts(10, 3, 0, 1, 14), aggregator.categories());
    assertEquals(1, aggregator.successfulRetries());
    assertEquals(2, aggregator.exhaustedRetries());
    assertEquals(3, aggregator.conflicts());
    assertEquals(14, aggregator.completedRequests());
    assertEquals(0, aggregator.entries().get(0).report().workerIndex());
    assertTrue(aggregator.consistencyWarnings().isEmpty());
  }

  @Test
  void mismatch_isReportedPerWorker() {
    var aggregator = new ResultAggregator();
    aggregator.add(report(0, new CategoryCounts(3, 0, 0, 0, 3), 0, 0), 3);
    aggregator.add(report(2, new CategoryCounts(3, 1, 0, 0, 4), 0, 0), 3);

    var warnings = aggregator.consistencyWarnings();

    assertEquals(1, warnings.size());
    assertEquals("worker 2: completed=3, sum(categories)=4", warnings.get(0));
  }
}
