package com.mk.fx.qa.load.contention.conflict;

import com.mk.fx.qa.load.contention.model.ResourceStatus;
import java.util.Map;

/**
 * Body of one update request.
 *
 * @param fields JSON fields, always including {@code version}
 * @param nextStatus status this update moves the resource to, or null when the variant does not
 *     track status
 */
public record UpdateBody(Map<String, Object> fields, ResourceStatus nextStatus) {

  public UpdateBody {
    fields = Map.copyOf(fields);
  }
}
