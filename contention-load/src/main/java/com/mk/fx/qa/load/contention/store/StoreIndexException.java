package com.mk.fx.qa.load.contention.store;

/** The store could not resolve an index, which only happens when the pool is empty. */
public class StoreIndexException extends StoreException {

  public StoreIndexException(String message) {
    super(message);
  }
}
