package com.mk.fx.qa.load.contention.rest;

/**
 * Raised when a request never produced an HTTP response: connection refused, timeout, I/O failure,
 * or a body that could not be serialised.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
