package com.chatdigest.backend.slack.client;

import java.time.Duration;
import java.util.Optional;

/** Signals that the platform throttled a call. Carries the server-suggested wait when present. */
public class RateLimitedException extends ChatApiException {

  public static final String CODE = "ratelimited";

  private final Duration retryAfter;

  public RateLimitedException(String operation, Duration retryAfter) {
    super(operation, CODE, "Slack " + operation + " was rate limited");
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
