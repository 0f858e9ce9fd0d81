package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import com.mk.fx.qa.load.contention.model.UpdateType;
import com.mk.fx.qa.load.contention.rest.HttpMethod;
import com.mk.fx.qa.load.contention.store.ResourceState;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * {@code PUT /{resource}/{id}} with a body shape picked round-robin from the configured update
 * types. Only versions are tracked locally.
 */
public class FieldUpdateVariant implements UpdateVariant {

  private static final List<String> PRIORITIES = List.of("low", "medium", "high", "critical");
  private static final List<String> TITLE_PREFIXES =
      List.of("Implement", "Fix", "Update", "Refactor", "Test", "Deploy", "Review", "Optimize");
  private static final List<String> TITLE_SUBJECTS =
      List.of("authentication", "database", "API", "cache", "logging", "metrics", "UI", "docs");

  private static final List<String> TAGS = List.of("updated", "benchmark");

  private final List<UpdateType> updateTypes;

  public FieldUpdateVariant(List<UpdateType> updateTypes) {
    if (updateTypes == null || updateTypes.isEmpty()) {
      throw new IllegalArgumentException("At least one update type is required");
    }
    this.updateTypes = List.copyOf(updateTypes);
  }

  public List<UpdateType> updateTypes() {
    return updateTypes;
  }

  @Override
  public HttpMethod writeMethod() {
    return HttpMethod.PUT;
  }

  @Override
  public String writePath(ResourceEndpoints endpoints, String id) {
    return endpoints.resource(id);
  }

  @Override
  public String writeEndpoint(ResourceEndpoints endpoints) {
    return writeMethod() + " " + endpoints.resourceTemplate();
  }

  @Override
  public boolean tracksStatus() {
    return false;
  }

  @Override
  public Optional<UpdateBody> buildBody(ResourceState current, long counter, Random random) {
    var type = typeFor(counter);
    Map<String, Object> fields = new LinkedHashMap<>();
    switch (type) {
      case PRIORITY -> fields.put("priority", pick(PRIORITIES, random));
      case STATUS -> fields.put("status", randomStatus(random));
      case DESCRIPTION -> fields.put("description", "Updated description - request " + counter);
      case TITLE -> fields.put("title", randomTitle(random) + " (updated)");
      case FULL -> {
        fields.put("title", randomTitle(random) + " (full update)");
        fields.put("description", "Full update");
        fields.put("priority", pick(PRIORITIES, random));
        fields.put("status", randomStatus(random));
        fields.put("tags", TAGS);
      }
    }
    fields.put("version", current.version());
    return Optional.of(new UpdateBody(fields, null));
  }

  @Override
  public Optional<ResourceState> refresh(ResourceState local, ResourceSnapshot snapshot) {
    if (snapshot.getVersion() == null) {
      return Optional.empty();
    }
    return Optional.of(new ResourceState(local.id(), snapshot.getVersion(), local.status()));
  }

  UpdateType typeFor(long counter) {
    return updateTypes.get((int) Math.floorMod(counter, (long) updateTypes.size()));
  }

  private static String randomTitle(Random random) {
    return pick(TITLE_PREFIXES, random) + " " + pick(TITLE_SUBJECTS, random);
  }

  private static String randomStatus(Random random) {
    var values = ResourceStatus.values();
    return values[random.nextInt(values.length)].wireValue();
  }

  private static String pick(List<String> values, Random random) {
    return values.get(random.nextInt(values.size()));
  }
}
