package com.mk.fx.qa.load.contention.processors.conflict;

import com.mk.fx.qa.load.contention.rest.Request;
import com.mk.fx.qa.load.contention.rest.RestResponseData;

/** Sends one request and waits for its response. {@code LoadHttpClient::execute} in production. */
@FunctionalInterface
public interface RequestSender {
  RestResponseData send(Request request);
}
