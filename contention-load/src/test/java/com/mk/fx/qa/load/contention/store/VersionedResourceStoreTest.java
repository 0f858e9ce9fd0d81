package com.mk.fx.qa.load.contention.store;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionedResourceStoreTest {

  private final VersionedResourceStore store = new VersionedResourceStore(List.of("a", "b", "c"));

  @Test
  void newStore_startsAtVersionOnePending() throws Exception {
    for (int i = 1; i <= 3; i++) {
      assertEquals(1L, store.getState(i).version());
      assertEquals(ResourceStatus.PENDING, store.getState(i).status());
    }
  }

  @Test
  void indices_areOneBasedAndWrap() throws Exception {
    assertEquals("a", store.getId(1));
    assertEquals("c", store.getId(3));
    assertEquals("a", store.getId(4));
    assertEquals("c", store.getId(0));
    assertEquals("b", store.getId(-1));
    assertEquals("b", store.getId(Integer.MAX_VALUE));
  }

  @Test
  void incrementVersion_returnsNewVersion() throws Exception {
    assertEquals(2L, store.incrementVersion(2));
    assertEquals(3L, store.incrementVersion(5));
    assertEquals(3L, store.getState(2).version());
  }

  @Test
  void setVersionAndStatus_rejectsInvalidInput_andKeepsPreviousValues() throws Exception {
    store.setVersionAndStatus(1, 7, ResourceStatus.IN_PROGRESS);

    assertThrows(StoreValidationException.class, () -> store.setVersion(1, 0));
    assertThrows(
        StoreValidationException.class,
        () -> store.setVersionAndStatus(1, 8, null));

    assertEquals(7L, store.getState(1).version());
    assertEquals(ResourceStatus.IN_PROGRESS, store.getState(1).status());
  }

  @Test
  void emptyStore_rejectsEveryIndex() {
    var empty = new VersionedResourceStore(List.of());

    assertThrows(StoreIndexException.class, () -> empty.getState(1));
    assertThrows(StoreIndexException.class, () -> empty.incrementVersion(1));
  }

  @Test
  void resetAll_restoresInitialState() throws Exception {
    store.setVersionAndStatus(3, 12, ResourceStatus.CANCELLED);

    store.resetAll();

    var snapshot = store.snapshot();
    assertEquals(3, snapshot.size());
    assertTrue(snapshot.stream().allMatch(s -> s.version() == 1L));
    assertTrue(snapshot.stream().allMatch(s -> s.status() == ResourceStatus.PENDING));
  }

  @Test
  void getState_isPeriodicInPoolSize() throws Exception {
    store.setVersionAndStatus(2, 5, ResourceStatus.COMPLETED);

    for (int i = -4; i <= 7; i++) {
      assertEquals(store.getState(i), store.getState(i + store.size()), "index " + i);
    }
  }

  @Test
  void resetAll_twiceMatchesOnce() throws Exception {
    store.incrementVersion(1);
    store.setVersionAndStatus(3, 9, ResourceStatus.IN_PROGRESS);
    store.resetAll();
    var afterOne = store.snapshot();

    store.resetAll();

    assertEquals(afterOne, store.snapshot());
  }
}
