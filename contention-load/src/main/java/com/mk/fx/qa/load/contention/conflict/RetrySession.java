package com.mk.fx.qa.load.contention.conflict;

import lombok.Getter;

/**
 * State held while one worker resolves one conflict. Created on the first 409 of a normal update
 * and dropped on success, exhaustion or any unexpected outcome.
 */
@Getter
public final class RetrySession {

  private final int targetIndex;
  private UpdateBody pendingBody;
  private int attemptCount;

  RetrySession(int targetIndex) {
    this.targetIndex = targetIndex;
  }

  void prepare(UpdateBody body) {
    this.pendingBody = body;
  }

  /** Counts one more conflicted resend and returns the new total. */
  int recordConflict() {
    return ++attemptCount;
  }
}
