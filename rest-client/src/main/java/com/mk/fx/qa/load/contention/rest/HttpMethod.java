package com.mk.fx.qa.load.contention.rest;

/** HTTP verbs issued by the load workers. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE
}
