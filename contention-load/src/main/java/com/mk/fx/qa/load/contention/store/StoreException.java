package com.mk.fx.qa.load.contention.store;

/**
 * Base type for errors returned by {@link VersionedResourceStore}. Workers treat any of them as
 * "abandon this cycle and fall back" rather than a reason to stop.
 */
public abstract class StoreException extends Exception {

  protected StoreException(String message) {
    super(message);
  }
}
