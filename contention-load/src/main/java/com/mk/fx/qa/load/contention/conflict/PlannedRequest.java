package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.classify.RequestCategory;
import com.mk.fx.qa.load.contention.rest.Request;

/**
 * The request a worker sends this cycle and the category it was counted under.
 *
 * @param endpoint method and path template, e.g. {@code PUT /tasks/{id}}, for per-endpoint stats
 */
public record PlannedRequest(Request request, RequestCategory category, String endpoint) {}
