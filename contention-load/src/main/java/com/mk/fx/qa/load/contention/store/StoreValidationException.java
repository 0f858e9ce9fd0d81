package com.mk.fx.qa.load.contention.store;

/** A version or status handed to the store was not acceptable. */
public class StoreValidationException extends StoreException {

  public StoreValidationException(String message) {
    super(message);
  }
}
