package com.chatdigest.backend.shared.time;

import java.time.Duration;

/**
 * Blocking pause used between retried API calls and between conversations. Tests substitute a
 * recording implementation so that backoff schedules can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> {
      if (duration != null && !duration.isNegative() && !duration.isZero()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
