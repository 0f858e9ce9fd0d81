package com.mk.fx.qa.load.contention.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IdPartitionerTest {

  @Test
  void twentyWorkersOverTenIds_suppressesTheSurplus() {
    var partitioner = new IdPartitioner(10, 20);

    assertEquals(10, partitioner.getEffectiveWorkerCount());
    assertEquals(10, partitioner.suppressedWorkerCount());

    var partitions = partitioner.partitionAll();
    assertEquals(20, partitions.size());
    for (int i = 0; i < 10; i++) {
      assertFalse(partitions.get(i).suppressed());
      assertEquals(i, partitions.get(i).startIndex());
      assertEquals(1, partitions.get(i).rangeSize());
    }
    for (int i = 10; i < 20; i++) {
      assertTrue(partitions.get(i).suppressed());
      assertEquals(0, partitions.get(i).rangeSize());
    }
  }

  @Test
  void activeRanges_areDisjoint() {
    var partitioner = new IdPartitioner(10, 3);
    Set<Integer> seen = new HashSet<>();

    for (var partition : partitioner.partitionAll()) {
      assertEquals(3, partition.rangeSize());
      for (long counter = 0; counter < partition.rangeSize(); counter++) {
        assertTrue(seen.add(partition.indexFor(counter)));
      }
    }

    assertThat(seen).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9);
  }

  @Test
  void indexFor_roundRobinsStartingAtSecondId() {
    var partition = new IdPartitioner(10, 2).partitionFor(1);

    assertEquals(5, partition.startIndex());
    assertEquals(7, partition.indexFor(1));
    assertEquals(10, partition.indexFor(4));
    assertEquals(6, partition.indexFor(5));
  }

  @Test
  void invalidCounts_fallBackToDefaults() {
    var partitioner = new IdPartitioner(0, -3);

    assertEquals(IdPartitioner.DEFAULT_POOL_SIZE, partitioner.getPoolSize());
    assertEquals(IdPartitioner.DEFAULT_WORKER_COUNT, partitioner.getWorkerCount());
  }

  @Test
  void suppressedPartition_hasNoIndices() {
    var partition = new IdPartitioner(1, 2).partitionFor(1);

    assertThrows(IllegalStateException.class, () -> partition.indexFor(1));
  }

  @Test
  void workerIndexOutOfRange_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> new IdPartitioner(4, 2).partitionFor(2));
  }
}
