package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import com.mk.fx.qa.load.contention.rest.HttpMethod;
import com.mk.fx.qa.load.contention.store.ResourceState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * {@code PATCH /{resource}/{id}/status} moving the resource along {@link StatusTransitions}.
 * Terminal resources produce no body and are skipped by the caller.
 */
public class StatusTransitionVariant implements UpdateVariant {

  @Override
  public HttpMethod writeMethod() {
    return HttpMethod.PATCH;
  }

  @Override
  public String writePath(ResourceEndpoints endpoints, String id) {
    return endpoints.status(id);
  }

  @Override
  public String writeEndpoint(ResourceEndpoints endpoints) {
    return writeMethod() + " " + endpoints.statusTemplate();
  }

  @Override
  public boolean tracksStatus() {
    return true;
  }

  @Override
  public Optional<UpdateBody> buildBody(ResourceState current, long counter, Random random) {
    var candidates = StatusTransitions.allowedFrom(current.status());
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    var next = candidates.get(random.nextInt(candidates.size()));
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("status", next.wireValue());
    fields.put("version", current.version());
    return Optional.of(new UpdateBody(fields, next));
  }

  @Override
  public Optional<ResourceState> refresh(ResourceState local, ResourceSnapshot snapshot) {
    if (snapshot.getVersion() == null) {
      return Optional.empty();
    }
    return ResourceStatus.fromWire(snapshot.getStatus())
        .map(status -> new ResourceState(local.id(), snapshot.getVersion(), status));
  }
}
