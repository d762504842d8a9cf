package com.chatdigest.backend.slack.client;

import java.time.Duration;

/**
 * Per-call retry bookkeeping. {@code attempt} is 1-based and {@code nextDelay} is the backoff that
 * applies if the current attempt is throttled.
 */
record RetryState(int attempt, Duration nextDelay) {

  static RetryState initial(Duration baseDelay) {
    return new RetryState(1, baseDelay);
  }

  RetryState next() {
    return new RetryState(attempt + 1, nextDelay.multipliedBy(2));
  }
}
