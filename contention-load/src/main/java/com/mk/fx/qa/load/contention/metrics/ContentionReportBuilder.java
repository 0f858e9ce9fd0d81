package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;
import com.mk.fx.qa.load.contention.metrics.ResultAggregator.Entry;
import com.mk.fx.qa.load.contention.store.ResourceState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ContentionReportBuilder {

  ContentionRunReport build(
      RunConfig config,
      Instant startedAt,
      ResultAggregator aggregator,
      long executedResponses,
      double achievedRps,
      LatencyTracker latency,
      ErrorTracker errors,
      StatusDistribution statusDistribution,
      List<ProtocolMetricsProvider> protocolProviders,
      List<ResourceState> store,
      CompletionInfo completionInfo) {

    var r = new ContentionRunReport();

    r.taskId = config.taskId();
    r.taskType = config.taskType();
    r.startTime = startedAt;
    var end = Instant.now();
    r.endTime = end;
    r.durationSec = Math.max(0.0, Duration.between(startedAt, end).toMillis() / 1000.0);

    var env = new ContentionRunReport.EnvInfo();
    env.host = EnvironmentInfo.host();
    env.triggeredBy = EnvironmentInfo.triggeredBy();
    r.environment = env;

    r.config = config(config);

    var totals = aggregator.categories();
    var categories = new ContentionRunReport.Categories();
    categories.executed = totals.executed();
    categories.backoff = totals.backoff();
    categories.suppressed = totals.suppressed();
    categories.fallback = totals.fallback();
    categories.requestsIssued = totals.requestsIssued();
    categories.excluded = totals.excluded();
    r.categories = categories;

    var retries = new ContentionRunReport.Retries();
    retries.conflicts = aggregator.conflicts();
    retries.successful = aggregator.successfulRetries();
    retries.exhausted = aggregator.exhaustedRetries();
    r.retries = retries;

    var m = new ContentionRunReport.Metrics();
    m.completedRequests = aggregator.completedRequests();
    m.executedResponses = executedResponses;
    m.transportFailures = errors.transportFailures();
    m.httpErrors = errors.httpErrors();
    m.actualErrorRate = statusDistribution.actualErrorRate();
    m.achievedRps = achievedRps;
    var lat = new ContentionRunReport.Latency();
    lat.min = latency.minMs().orElse(0L);
    lat.avg = latency.avgMs().orElse(0L);
    lat.max = latency.maxMs().orElse(0L);
    lat.p95 = latency.p95Ms().orElse(0L);
    lat.p99 = latency.p99Ms().orElse(0L);
    m.latency = lat;
    List<ContentionRunReport.ErrorItem> errs = new ArrayList<>();
    for (Map.Entry<String, Long> e : errors.breakdownSnapshot().entrySet()) {
      var item = new ContentionRunReport.ErrorItem();
      item.type = e.getKey();
      item.count = e.getValue();
      errs.add(item);
    }
    errs.sort((a, b) -> Long.compare(b.count, a.count));
    m.errorBreakdown = List.copyOf(errs);
    m.errorSamples = errors.samplesSnapshot();
    r.metrics = m;

    List<ContentionRunReport.WorkerEntry> workers = new ArrayList<>();
    for (Entry e : aggregator.entries()) {
      workers.add(worker(e));
    }
    r.workers = List.copyOf(workers);

    r.store = store == null ? List.of() : store.stream().map(this::storeEntry).toList();

    r.consistencyWarnings = aggregator.consistencyWarnings();

    for (ProtocolMetricsProvider provider : protocolProviders) {
      provider.applyTo(r);
    }

    r.completion = completion(completionInfo, config);
    r.summary = summary(r);
    return r;
  }

  private ContentionRunReport.Config config(RunConfig config) {
    var cfg = new ContentionRunReport.Config();
    cfg.baseUrl = config.baseUrl();
    cfg.workersRequested = config.workersRequested();
    cfg.workersEffective = config.workersEffective();
    cfg.suppressedWorkers = config.suppressedWorkers();
    cfg.idPoolSize = config.idPoolSize();
    cfg.cyclesPerWorker = config.cyclesPerWorker();
    cfg.warmup = config.warmup();
    cfg.rampUp = config.rampUp();
    cfg.duration = config.duration();
    cfg.ratePerWorker = config.ratePerWorker();
    cfg.retryCount = config.retryCount();
    cfg.backoffBase = config.backoffBase();
    cfg.backoffMax = config.backoffMax();
    cfg.backoffPolicy = config.backoffPolicy();
    cfg.updateTypes = config.updateTypes();
    cfg.countExcludedInRate = config.countExcludedInRate();
    cfg.defaultedSettings = config.defaultedSettings();
    return cfg;
  }

  private ContentionRunReport.WorkerEntry worker(Entry e) {
    var report = e.report();
    var w = new ContentionRunReport.WorkerEntry();
    w.workerIndex = report.workerIndex();
    w.suppressed = report.suppressed();
    w.executed = report.categories().executed();
    w.backoff = report.categories().backoff();
    w.suppressedRequests = report.categories().suppressed();
    w.fallback = report.categories().fallback();
    w.requestsIssued = report.categories().requestsIssued();
    w.completedRequests = e.completedRequests();
    w.successfulRetries = report.successfulRetries();
    w.exhaustedRetries = report.exhaustedRetries();
    w.conflicts = report.conflicts();
    w.transportFailures = report.transportFailures();
    return w;
  }

  private ContentionRunReport.StoreEntry storeEntry(ResourceState state) {
    var s = new ContentionRunReport.StoreEntry();
    s.id = state.id();
    s.version = state.version();
    s.status = state.status() != null ? state.status().wireValue() : null;
    return s;
  }

  private ContentionRunReport.Completion completion(CompletionInfo info, RunConfig config) {
    var c = new ContentionRunReport.Completion();
    String reason;
    if (info == null) {
      c.totalWorkers = config.workersRequested();
      reason = "ERROR";
    } else {
      c.totalWorkers = info.totalWorkers();
      c.completedWorkers = info.completedWorkers();
      if (info.cancelled()) {
        reason = "CANCELLED";
      } else if (info.durationExpired()) {
        reason = "DURATION_EXPIRED";
      } else if (info.completedWorkers() >= info.totalWorkers()) {
        reason = "ALL_WORKERS_FINISHED";
      } else {
        reason = "ERROR";
      }
    }
    c.reason = reason;
    c.message =
        switch (reason) {
          case "ALL_WORKERS_FINISHED" -> "All workers completed their cycles.";
          case "DURATION_EXPIRED" -> "Execution ran for the configured duration.";
          case "CANCELLED" -> "Execution cancelled before completion.";
          default -> "Execution stopped before completion due to errors or early termination.";
        };
    return c;
  }

  private ContentionRunReport.Summary summary(ContentionRunReport r) {
    var s = new ContentionRunReport.Summary();
    var m = r.metrics;
    long conflicts409 =
        r.statusDistribution != null ? r.statusDistribution.overall.getOrDefault("409", 0L) : 0L;
    long hardErrors = Math.max(0, m.httpErrors - conflicts409) + m.transportFailures;
    double hardErrorRate = m.completedRequests == 0 ? 0.0 : (double) hardErrors / m.completedRequests;

    String status;
    if (!r.consistencyWarnings.isEmpty()) {
      status = "INCONSISTENT";
    } else if (hardErrors == 0) {
      status = "SUCCESS";
    } else if (hardErrorRate < 0.05) {
      status = "PARTIAL_SUCCESS";
    } else {
      status = "FAILED";
    }
    s.status = status;
    s.message =
        switch (status) {
          case "SUCCESS" -> "No failures other than expected version conflicts.";
          case "PARTIAL_SUCCESS" -> "Minor failures observed; overall run largely successful.";
          case "INCONSISTENT" -> "Request categories do not add up for some workers.";
          default -> "Failures observed; review errors and status distribution.";
        };

    s.highlights = new ArrayList<>();
    s.highlights.add("executed=" + r.categories.executed);
    s.highlights.add("excluded=" + r.categories.excluded);
    s.highlights.add(
        "retries ok/exhausted=" + r.retries.successful + "/" + r.retries.exhausted);
    s.highlights.add(String.format("errorRate=%.2f%%", m.actualErrorRate * 100));
    s.highlights.add(String.format("achievedRps=%.2f", m.achievedRps));
    if (r.completion != null) s.highlights.add("completion=" + r.completion.reason);

    s.concerns = new ArrayList<>();
    if (m.transportFailures > 0) s.concerns.add("transportFailures=" + m.transportFailures);
    if (hardErrors - m.transportFailures > 0)
      s.concerns.add("httpFailures=" + (hardErrors - m.transportFailures));
    if (r.retries.exhausted > 0) s.concerns.add("exhaustedRetries=" + r.retries.exhausted);
    if (r.config.suppressedWorkers > 0)
      s.concerns.add("suppressedWorkers=" + r.config.suppressedWorkers);
    s.concerns.addAll(r.consistencyWarnings);
    return s;
  }
}
