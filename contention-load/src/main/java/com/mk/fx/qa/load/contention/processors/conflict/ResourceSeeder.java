package com.mk.fx.qa.load.contention.processors.conflict;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mk.fx.qa.load.contention.conflict.ResourceEndpoints;
import com.mk.fx.qa.load.contention.rest.HttpMethod;
import com.mk.fx.qa.load.contention.rest.JsonUtil;
import com.mk.fx.qa.load.contention.rest.Request;
import com.mk.fx.qa.load.contention.rest.TransportException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/** Creates the resource pool through the API under test before a run. */
@Slf4j
public class ResourceSeeder {

  private static final List<String> PRIORITIES = List.of("low", "medium", "high", "critical");

  private final RequestSender sender;
  private final ResourceEndpoints endpoints;
  private final Random random;

  public ResourceSeeder(RequestSender sender, ResourceEndpoints endpoints, Random random) {
    this.sender = sender;
    this.endpoints = endpoints;
    this.random = random;
  }

  /**
   * Creates {@code count} resources and returns their ids in creation order. Individual failures
   * are logged and skipped.
   *
   * @throws IllegalStateException if no resource could be created
   */
  public List<String> seed(int count) {
    List<String> ids = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      var body =
          Map.<String, Object>of(
              "title", "Contention task " + (i + 1),
              "description", "Benchmark task",
              "priority", PRIORITIES.get(random.nextInt(PRIORITIES.size())));
      try {
        var response = sender.send(Request.withBody(HttpMethod.POST, endpoints.resourcePath(), body));
        if (!response.isSuccessful()) {
          log.warn("Seeding resource {} failed with status {}", i + 1, response.getStatusCode());
          continue;
        }
        var created = JsonUtil.tryParse(response.getBody(), Created.class);
        if (created.isEmpty() || created.get().getId() == null || created.get().getId().isBlank()) {
          log.warn("Seeding resource {} returned no id", i + 1);
          continue;
        }
        ids.add(created.get().getId());
      } catch (TransportException e) {
        throw new IllegalStateException("Target unreachable while seeding: " + e.getMessage(), e);
      }
    }
    if (ids.isEmpty()) {
      throw new IllegalStateException("Seeding produced no resources");
    }
    log.info("Seeded {}/{} resources at {}", ids.size(), count, endpoints.resourcePath());
    return List.copyOf(ids);
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class Created {
    private String id;
  }
}
