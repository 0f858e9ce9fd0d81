package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.rest.HttpMethod;
import com.mk.fx.qa.load.contention.store.ResourceState;
import java.util.Optional;
import java.util.Random;

/**
 * What a worker writes and how it reads back a refreshed resource. The retry protocol itself lives
 * in {@link ConflictRetryStateMachine}; a variant only decides the request shape.
 */
public interface UpdateVariant {

  /** Method used for both the normal update and the retry write. */
  HttpMethod writeMethod();

  String writePath(ResourceEndpoints endpoints, String id);

  /** Endpoint label for metrics, with the id left as a template, e.g. {@code PUT /tasks/{id}}. */
  String writeEndpoint(ResourceEndpoints endpoints);

  /** True when the local store must follow the resource status as well as its version. */
  boolean tracksStatus();

  /**
   * Builds the body for the given resource.
   *
   * @param current local view of the resource, whose version is echoed in the body
   * @param counter selects the update shape where the variant rotates between several
   * @return empty when the resource cannot be updated any more
   */
  Optional<UpdateBody> buildBody(ResourceState current, long counter, Random random);

  /**
   * Merges a {@code GET} response into the local view.
   *
   * @return empty when the response lacks a field this variant needs
   */
  Optional<ResourceState> refresh(ResourceState local, ResourceSnapshot snapshot);
}
