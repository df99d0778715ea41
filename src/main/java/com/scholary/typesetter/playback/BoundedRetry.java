package com.scholary.typesetter.playback;

import java.util.function.BooleanSupplier;

/** Counts attempts of an operation that is retried once per frame. */
class BoundedRetry {

  enum Outcome {
    SUCCEEDED,
    RETRY,
    EXHAUSTED
  }

  private final int maxAttempts;
  private int attempts;

  BoundedRetry(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  Outcome attempt(BooleanSupplier operation) {
    if (attempts >= maxAttempts) {
      return Outcome.EXHAUSTED;
    }
    attempts++;
    if (operation.getAsBoolean()) {
      attempts = 0;
      return Outcome.SUCCEEDED;
    }
    return attempts >= maxAttempts ? Outcome.EXHAUSTED : Outcome.RETRY;
  }

  int attempts() {
    return attempts;
  }
}
