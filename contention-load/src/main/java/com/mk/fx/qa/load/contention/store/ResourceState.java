package com.mk.fx.qa.load.contention.store;

import com.mk.fx.qa.load.contention.model.ResourceStatus;

/**
 * Point-in-time copy of one tracked resource.
 *
 * @param id opaque resource identifier
 * @param version last version the generator believes the server holds
 * @param status last known status
 */
public record ResourceState(String id, long version, ResourceStatus status) {}
