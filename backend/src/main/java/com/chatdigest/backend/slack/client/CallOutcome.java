package com.chatdigest.backend.slack.client;

/** Result of a single attempt inside {@link RateLimitedCaller}. */
record CallOutcome<T>(Status status, T value, RateLimitedException rateLimit, RuntimeException failure) {

  enum Status {
    SUCCESS,
    RATE_LIMITED,
    FAILED
  }

  static <T> CallOutcome<T> success(T value) {
    return new CallOutcome<>(Status.SUCCESS, value, null, null);
  }

  static <T> CallOutcome<T> rateLimited(RateLimitedException exception) {
    return new CallOutcome<>(Status.RATE_LIMITED, null, exception, null);
  }

  static <T> CallOutcome<T> failed(RuntimeException exception) {
    return new CallOutcome<>(Status.FAILED, null, null, exception);
  }
}
