package com.mk.fx.qa.load.contention.classify;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-worker request accounting.
 *
 * <p>{@link #classify} is called once per cycle before the request is sent; it records the category
 * and bumps both the category counter and the issued total in one step, so {@code executed +
 * backoff + suppressed + fallback == requestsIssued} holds for every reader at every point. The
 * response side calls {@link #consume} to learn how the request was labelled and clears the flag.
 * The end-of-run comparison with completed requests is done by {@code ResultAggregator}.
 *
 * <p>Owned by a single worker thread. Methods are synchronized only so that live snapshots taken
 * from another thread see a consistent set of counters.
 */
public class RequestClassifier {

  private final int workerIndex;
  private final Map<RequestCategory, Long> counts = new EnumMap<>(RequestCategory.class);
  private long requestsIssued;
  private RequestCategory pending;

  public RequestClassifier(int workerIndex) {
    this.workerIndex = workerIndex;
    for (RequestCategory category : RequestCategory.values()) {
      counts.put(category, 0L);
    }
  }

  /**
   * Labels the request about to be sent.
   *
   * @throws IllegalStateException if the previous request's label was never consumed
   */
  public synchronized void classify(RequestCategory category) {
    if (pending != null) {
      throw new IllegalStateException(
          "Worker " + workerIndex + " classified a new request before consuming " + pending);
    }
    pending = category;
    counts.merge(category, 1L, Long::sum);
    requestsIssued++;
  }

  /**
   * Returns the label recorded for the in-flight request and clears it.
   *
   * @throws IllegalStateException if nothing is pending
   */
  public synchronized RequestCategory consume() {
    var category = pending;
    if (category == null) {
      throw new IllegalStateException("Worker " + workerIndex + " has no classified request");
    }
    pending = null;
    return category;
  }

  public synchronized boolean hasPending() {
    return pending != null;
  }

  public synchronized CategoryCounts snapshot() {
    return new CategoryCounts(
        counts.get(RequestCategory.EXECUTED),
        counts.get(RequestCategory.BACKOFF),
        counts.get(RequestCategory.SUPPRESSED),
        counts.get(RequestCategory.FALLBACK),
        requestsIssued);
  }
}
