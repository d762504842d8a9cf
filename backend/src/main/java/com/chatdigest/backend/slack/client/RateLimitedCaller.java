package com.chatdigest.backend.slack.client;

import com.chatdigest.backend.shared.time.Sleeper;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs platform calls with exponential backoff on rate-limit signals. Each call owns its own
 * {@link RetryState}; nothing is shared between concurrent callers. Only {@link
 * RateLimitedException} is retried, every other failure surfaces on the first attempt.
 */
public class RateLimitedCaller {

  private static final Logger log = LoggerFactory.getLogger(RateLimitedCaller.class);

  private final int maxRetries;
  private final Duration baseBackoff;
  private final Sleeper sleeper;

  public RateLimitedCaller(int maxRetries, Duration baseBackoff, Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    this.maxRetries = maxRetries;
    this.baseBackoff = Objects.requireNonNull(baseBackoff, "baseBackoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  @FunctionalInterface
  public interface ApiCall<T> {
    T execute();
  }

  public <T> T call(String operation, ApiCall<T> apiCall) {
    RetryState state = RetryState.initial(baseBackoff);
    while (true) {
      CallOutcome<T> outcome = attempt(apiCall);
      switch (outcome.status()) {
        case SUCCESS -> {
          return outcome.value();
        }
        case FAILED -> throw outcome.failure();
        case RATE_LIMITED -> {
          if (state.attempt() > maxRetries) {
            throw new RetriesExhaustedException(operation, state.attempt(), outcome.rateLimit());
          }
          Duration wait = waitFor(outcome.rateLimit(), state);
          log.warn(
              "Slack {} rate limited on attempt {}/{}, retrying in {} ms",
              operation,
              state.attempt(),
              maxRetries + 1,
              wait.toMillis());
          pause(operation, wait);
          state = state.next();
        }
        default -> throw new IllegalStateException("Unexpected outcome " + outcome.status());
      }
    }
  }

  private <T> CallOutcome<T> attempt(ApiCall<T> apiCall) {
    try {
      return CallOutcome.success(apiCall.execute());
    } catch (RateLimitedException exception) {
      return CallOutcome.rateLimited(exception);
    } catch (RuntimeException exception) {
      return CallOutcome.failed(exception);
    }
  }

  private Duration waitFor(RateLimitedException rateLimit, RetryState state) {
    Duration backoff = state.nextDelay();
    return rateLimit
        .getRetryAfter()
        .filter(retryAfter -> retryAfter.compareTo(backoff) > 0)
        .orElse(backoff);
  }

  private void pause(String operation, Duration wait) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new ChatApiException(operation, "interrupted", "Interrupted while backing off", exception);
    }
  }
}
