package com.mk.fx.qa.load.contention.cfg;

import com.mk.fx.qa.load.contention.conflict.BackoffPolicy;
import com.mk.fx.qa.load.contention.conflict.RetryPolicy;
import com.mk.fx.qa.load.contention.model.TaskType;
import com.mk.fx.qa.load.contention.model.UpdateType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Typed view of a run's environment-style settings. Parsing never fails: a missing or invalid value
 * falls back to its default with a warning, and {@link #defaultedKeys()} records which keys did.
 */
@Slf4j
public record ConflictLoadSettings(
    ConfiguredValue<Integer> retryCount,
    ConfiguredValue<Integer> backoffMax,
    ConfiguredValue<Integer> backoffBase,
    ConfiguredValue<BackoffPolicy> backoffPolicy,
    ConfiguredValue<Integer> workers,
    ConfiguredValue<Integer> idPoolSize,
    ConfiguredValue<List<UpdateType>> updateTypes,
    ConfiguredValue<Boolean> countExcludedInRate,
    ConfiguredValue<Long> seed,
    List<String> defaultedKeys) {

  public static final String RETRY_COUNT = "RETRY_COUNT";
  public static final String RETRY_BACKOFF_MAX = "RETRY_BACKOFF_MAX";
  public static final String RETRY_BACKOFF_BASE = "RETRY_BACKOFF_BASE";
  public static final String BACKOFF_POLICY = "BACKOFF_POLICY";
  public static final String WORKERS = "WORKERS";
  public static final List<String> WORKER_ALIASES = List.of(WORKERS, "WRK_THREADS", "THREADS");
  public static final String ID_POOL_SIZE = "ID_POOL_SIZE";
  public static final String UPDATE_TYPES = "UPDATE_TYPES";
  public static final String COUNT_EXCLUDED_IN_RATE = "COUNT_EXCLUDED_IN_RATE";
  public static final String SEED = "SEED";

  static final int DEFAULT_BACKOFF_MAX = 16;
  static final int DEFAULT_BACKOFF_BASE = 2;
  static final int DEFAULT_WORKERS = 1;
  static final int DEFAULT_ID_POOL_SIZE = 10;

  public ConflictLoadSettings {
    defaultedKeys = List.copyOf(defaultedKeys);
  }

  /** Retries are opt-in for field updates and on by one attempt for status transitions. */
  public static int defaultRetryCount(TaskType taskType) {
    return taskType == TaskType.TASKS_UPDATE_STATUS ? 1 : 0;
  }

  public static ConflictLoadSettings fromEnvironment(Map<String, String> env, TaskType taskType) {
    var source = env != null ? env : Map.<String, String>of();
    var parser = new Parser(source);

    var retryCount = parser.integer(RETRY_COUNT, 0, defaultRetryCount(taskType));
    var backoffMax = parser.integer(RETRY_BACKOFF_MAX, 1, DEFAULT_BACKOFF_MAX);
    var backoffBase = parser.integer(RETRY_BACKOFF_BASE, 1, DEFAULT_BACKOFF_BASE);
    var policy =
        parser.parse(BACKOFF_POLICY, BackoffPolicy::fromValue, BackoffPolicy.FULL_JITTER);
    var workers = parser.integer(parser.firstPresent(WORKER_ALIASES), 1, DEFAULT_WORKERS);
    var poolSize = parser.integer(ID_POOL_SIZE, 1, DEFAULT_ID_POOL_SIZE);
    var updateTypes = parser.updateTypes();
    var countExcluded = parser.parse(COUNT_EXCLUDED_IN_RATE, Parser::bool, Boolean.TRUE);
    var seed = parser.parse(SEED, Parser::longValue, null);

    return new ConflictLoadSettings(
        retryCount,
        backoffMax,
        backoffBase,
        policy,
        workers,
        poolSize,
        updateTypes,
        countExcluded,
        seed,
        parser.defaulted);
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(
        retryCount.value(), backoffBase.value(), backoffMax.value(), backoffPolicy.value());
  }

  /** Seed for one worker's random source, or empty when no SEED was supplied. */
  public Optional<Long> workerSeed(int workerIndex) {
    return Optional.ofNullable(seed.value()).map(s -> s + workerIndex);
  }

  private static final class Parser {

    private final Map<String, String> env;
    private final List<String> defaulted = new ArrayList<>();

    Parser(Map<String, String> env) {
      this.env = env;
    }

    String firstPresent(List<String> keys) {
      return keys.stream().filter(env::containsKey).findFirst().orElse(keys.get(0));
    }

    ConfiguredValue<Integer> integer(String key, int min, int defaultValue) {
      return parse(key, raw -> intValue(raw).filter(v -> v >= min), defaultValue);
    }

    <T> ConfiguredValue<T> parse(String key, Function<String, Optional<T>> parse, T defaultValue) {
      var raw = env.get(key);
      if (raw == null || raw.isBlank()) {
        defaulted.add(key);
        return ConfiguredValue.defaulted(defaultValue);
      }
      var parsed = parse.apply(raw.trim());
      if (parsed.isEmpty()) {
        log.warn("Invalid value '{}' for {}, using default {}", raw, key, defaultValue);
        defaulted.add(key);
        return ConfiguredValue.defaulted(defaultValue);
      }
      return ConfiguredValue.of(parsed.get());
    }

    ConfiguredValue<List<UpdateType>> updateTypes() {
      var all = List.of(UpdateType.values());
      var raw = env.get(UPDATE_TYPES);
      if (raw == null || raw.isBlank()) {
        defaulted.add(UPDATE_TYPES);
        return ConfiguredValue.defaulted(all);
      }
      List<UpdateType> selected = new ArrayList<>();
      for (String entry : raw.split(",")) {
        if (entry.isBlank()) {
          continue;
        }
        var type = UpdateType.fromValue(entry);
        if (type.isPresent()) {
          selected.add(type.get());
        } else {
          log.warn(
              "Ignoring unknown update type '{}', expected one of {}",
              entry.trim(),
              Arrays.toString(UpdateType.values()));
        }
      }
      if (selected.isEmpty()) {
        log.warn("No valid {} in '{}', using all update types", UPDATE_TYPES, raw);
        defaulted.add(UPDATE_TYPES);
        return ConfiguredValue.defaulted(all);
      }
      return ConfiguredValue.of(List.copyOf(selected));
    }

    static Optional<Integer> intValue(String raw) {
      try {
        return Optional.of(Integer.parseInt(raw));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }

    static Optional<Long> longValue(String raw) {
      try {
        return Optional.of(Long.parseLong(raw));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }

    static Optional<Boolean> bool(String raw) {
      if ("true".equalsIgnoreCase(raw) || "1".equals(raw) || "yes".equalsIgnoreCase(raw)) {
        return Optional.of(Boolean.TRUE);
      }
      if ("false".equalsIgnoreCase(raw) || "0".equals(raw) || "no".equalsIgnoreCase(raw)) {
        return Optional.of(Boolean.FALSE);
      }
      return Optional.empty();
    }
  }
}
