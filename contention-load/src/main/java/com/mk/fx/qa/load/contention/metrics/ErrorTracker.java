package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts failures by type. Transport failures are keyed by their root cause, HTTP failures by
 * status code. The first few transport failures keep a trimmed stack for the report.
 */
final class ErrorTracker {

  private static final int MAX_ERROR_SAMPLES = 5;

  private final AtomicLong transportFailures = new AtomicLong();
  private final AtomicLong httpErrors = new AtomicLong();
  private final Map<String, AtomicLong> breakdown = new ConcurrentHashMap<>();
  private final List<ContentionRunReport.ErrorSample> samples = new CopyOnWriteArrayList<>();

  void recordTransportFailure(Throwable t) {
    transportFailures.incrementAndGet();
    String key = classify(t);
    breakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    if (t != null && samples.size() < MAX_ERROR_SAMPLES) {
      samples.add(buildSample(key, t));
    }
  }

  /** Any executed response with status 400 or above, 409 included. */
  void recordHttpError(int statusCode) {
    httpErrors.incrementAndGet();
    breakdown.computeIfAbsent("HTTP_" + statusCode, k -> new AtomicLong()).incrementAndGet();
  }

  long transportFailures() {
    return transportFailures.get();
  }

  long httpErrors() {
    return httpErrors.get();
  }

  long totalErrors() {
    return transportFailures.get() + httpErrors.get();
  }

  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : breakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  List<ContentionRunReport.ErrorSample> samplesSnapshot() {
    return List.copyOf(samples);
  }

  static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    var clsName = rootCause(t).getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "InterruptedException" -> "INTERRUPTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  private static Throwable rootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root;
  }

  private static ContentionRunReport.ErrorSample buildSample(String type, Throwable t) {
    var root = rootCause(t);
    String msg = t.getMessage() != null ? t.getMessage() : root.getMessage();
    if (msg == null) {
      msg = root.getClass().getSimpleName() + " occurred";
    }

    List<String> frames = new ArrayList<>();
    if (root != t) {
      frames.add(
          "ROOT CAUSE: "
              + root.getClass().getSimpleName()
              + " - "
              + (root.getMessage() != null ? root.getMessage() : "no message"));
      appendFrames(frames, root.getStackTrace(), 3);
    }
    frames.add("WRAPPED BY: " + t.getClass().getSimpleName());
    appendFrames(frames, t.getStackTrace(), 8);
    return new ContentionRunReport.ErrorSample(type, msg, frames);
  }

  private static void appendFrames(List<String> frames, StackTraceElement[] stack, int limit) {
    for (int i = 0; i < Math.min(limit, stack.length); i++) {
      var f = stack[i];
      frames.add(
          "  at "
              + f.getClassName()
              + "."
              + f.getMethodName()
              + "("
              + f.getFileName()
              + ":"
              + f.getLineNumber()
              + ")");
    }
  }
}
