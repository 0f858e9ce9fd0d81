package com.mk.fx.qa.load.contention.store;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReferenceArray;
import lombok.extern.slf4j.Slf4j;

/**
 * The generator's view of the resource pool: id, version and status per slot.
 *
 * <p>Indices are 1-based and wrap around, so any int (including 0 and negatives) maps to slot
 * {@code ((i - 1) mod N) + 1}. Versions only move forward through {@link #incrementVersion} or a
 * resync from the server.
 *
 * <p>Each slot is read and written atomically, but there is no cross-worker locking: the pool is
 * partitioned so that one worker writes one id. When partitions overlap, local versions can lag the
 * server. The server's 409 remains the source of truth.
 */
@Slf4j
public class VersionedResourceStore {

  private final List<String> ids;
  private final AtomicLongArray versions;
  private final AtomicReferenceArray<ResourceStatus> statuses;

  public VersionedResourceStore(List<String> ids) {
    Objects.requireNonNull(ids, "ids");
    this.ids = List.copyOf(ids);
    this.versions = new AtomicLongArray(this.ids.size());
    this.statuses = new AtomicReferenceArray<>(this.ids.size());
    resetAll();
  }

  public int size() {
    return ids.size();
  }

  /** Returns the current state at {@code index} (1-based, wrapping). */
  public ResourceState getState(int index) throws StoreIndexException {
    int slot = slot(index);
    return new ResourceState(ids.get(slot), versions.get(slot), statuses.get(slot));
  }

  /** Returns the id at {@code index} (1-based, wrapping). */
  public String getId(int index) throws StoreIndexException {
    return ids.get(slot(index));
  }

  /**
   * Increments the tracked version. Callers must only do this after a response they attributed to a
   * successful write of this resource.
   *
   * @return the new version
   */
  public long incrementVersion(int index) throws StoreIndexException {
    return versions.incrementAndGet(slot(index));
  }

  /** Resynchronises the version alone, as the field-update variant does after a refresh. */
  public void setVersion(int index, long version) throws StoreException {
    int slot = slot(index);
    requirePositive(version);
    versions.set(slot, version);
  }

  /** Resynchronises version and status from an authoritative read. */
  public void setVersionAndStatus(int index, long version, ResourceStatus status)
      throws StoreException {
    int slot = slot(index);
    requirePositive(version);
    if (status == null) {
      throw new StoreValidationException("status must be a recognised value");
    }
    versions.set(slot, version);
    statuses.set(slot, status);
  }

  /** Puts every resource back to version 1 with the initial status. */
  public void resetAll() {
    for (int i = 0; i < ids.size(); i++) {
      versions.set(i, 1L);
      statuses.set(i, ResourceStatus.INITIAL);
    }
    log.debug("Reset {} resources to version 1/{}", ids.size(), ResourceStatus.INITIAL.wireValue());
  }

  /** Copies every slot, in index order, for diagnostics. */
  public List<ResourceState> snapshot() {
    List<ResourceState> copy = new ArrayList<>(ids.size());
    for (int i = 0; i < ids.size(); i++) {
      copy.add(new ResourceState(ids.get(i), versions.get(i), statuses.get(i)));
    }
    return copy;
  }

  private int slot(int index) throws StoreIndexException {
    if (ids.isEmpty()) {
      throw new StoreIndexException("resource pool is empty");
    }
    return (int) Math.floorMod((long) index - 1, (long) ids.size());
  }

  private static void requirePositive(long version) throws StoreValidationException {
    if (version < 1) {
      throw new StoreValidationException("version must be a positive integer, got " + version);
    }
  }
}
