package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Status moves the API accepts. A status with no outgoing moves is terminal. */
public final class StatusTransitions {

  private static final Map<ResourceStatus, List<ResourceStatus>> ALLOWED =
      new EnumMap<>(ResourceStatus.class);

  static {
    ALLOWED.put(
        ResourceStatus.PENDING, List.of(ResourceStatus.IN_PROGRESS, ResourceStatus.CANCELLED));
    ALLOWED.put(
        ResourceStatus.IN_PROGRESS,
        List.of(ResourceStatus.COMPLETED, ResourceStatus.PENDING, ResourceStatus.CANCELLED));
    ALLOWED.put(ResourceStatus.COMPLETED, List.of(ResourceStatus.PENDING));
    ALLOWED.put(ResourceStatus.CANCELLED, List.of());
  }

  private StatusTransitions() {}

  public static List<ResourceStatus> allowedFrom(ResourceStatus status) {
    return status == null ? List.of() : ALLOWED.get(status);
  }
}
