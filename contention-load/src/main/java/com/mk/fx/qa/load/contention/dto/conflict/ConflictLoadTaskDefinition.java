package com.mk.fx.qa.load.contention.dto.conflict;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * The {@code data} of a contention task: what to hit, how many resources, how long, and the
 * environment-style settings of the state machine.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConflictLoadTaskDefinition {

  @JsonProperty("target")
  private Target target;

  @JsonProperty("seed")
  private SeedConfig seed;

  @JsonProperty("execution")
  private ExecutionConfig execution;

  @JsonProperty("settings")
  private Map<String, String> settings;

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Target {

    @JsonProperty("baseUrl")
    private String baseUrl;

    @JsonProperty("headers")
    private Map<String, String> headers;

    @JsonProperty("timeouts")
    private TimeoutConfig timeouts;

    @JsonProperty("resourcePath")
    private String resourcePath;

    @JsonProperty("fallbackPath")
    private String fallbackPath;

    @JsonProperty("resourceIds")
    private List<String> resourceIds;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TimeoutConfig {

    @JsonProperty("connectionTimeoutMs")
    private Integer connectionTimeoutMs;

    @JsonProperty("requestTimeoutMs")
    private Integer requestTimeoutMs;
  }

  /** Resources to create before the run when no ids are given. */
  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SeedConfig {

    @JsonProperty("count")
    private Integer count;
  }

  @Getter
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExecutionConfig {

    @JsonProperty("cyclesPerWorker")
    private Long cyclesPerWorker;

    /** e.g. {@code 30s}, {@code 5m}. */
    @JsonProperty("duration")
    private String duration;

    @JsonProperty("warmup")
    private String warmup;

    @JsonProperty("rampUp")
    private String rampUp;

    @JsonProperty("ratePerWorker")
    private Double ratePerWorker;
  }
}
