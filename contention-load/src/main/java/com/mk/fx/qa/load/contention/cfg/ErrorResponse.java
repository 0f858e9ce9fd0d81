package com.mk.fx.qa.load.contention.cfg;

/**
 * Body returned by the API when a request cannot be served.
 *
 * @param error short error category
 * @param details the underlying message
 */
public record ErrorResponse(String error, String details) {}
