package com.mk.fx.qa.load.contention.classify;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RequestClassifierTest {

  @Test
  void classify_countsAtClassificationTime() {
    var classifier = new RequestClassifier(0);

    classifier.classify(RequestCategory.EXECUTED);

    var snapshot = classifier.snapshot();
    assertEquals(1, snapshot.executed());
    assertEquals(1, snapshot.requestsIssued());
    assertTrue(classifier.hasPending());
  }

  @Test
  void consume_returnsLabelAndClearsIt() {
    var classifier = new RequestClassifier(0);
    classifier.classify(RequestCategory.BACKOFF);

    assertEquals(RequestCategory.BACKOFF, classifier.consume());
    assertFalse(classifier.hasPending());
    assertThrows(IllegalStateException.class, classifier::consume);
  }

  @Test
  void classifyTwiceWithoutConsume_isRejected() {
    var classifier = new RequestClassifier(3);
    classifier.classify(RequestCategory.FALLBACK);

    var ex =
        assertThrows(
            IllegalStateException.class, () -> classifier.classify(RequestCategory.EXECUTED));
    assertTrue(ex.getMessage().contains("Worker 3"));
    assertEquals(1, classifier.snapshot().requestsIssued());
  }

  @Test
  void everyCategory_isCountedOnce() {
    var classifier = new RequestClassifier(0);
    for (RequestCategory category : RequestCategory.values()) {
      classifier.classify(category);
      classifier.consume();
    }

    var snapshot = classifier.snapshot();
    assertEquals(4, snapshot.sum());
    assertEquals(snapshot.requestsIssued(), snapshot.sum());
  }

  @Test
  void categoryCounts_sumAndExcluded() {
    var a = new CategoryCounts(5, 2, 1, 1, 9);
    var b = new CategoryCounts(1, 0, 0, 3, 4);

    var total = a.plus(b);

    assertEquals(13, total.sum());
    assertEquals(13, total.requestsIssued());
    assertEquals(7, total.excluded());
    assertEquals(4, total.fallback());
  }
}
