package com.chatdigest.backend.slack.client;

public class RetriesExhaustedException extends ChatApiException {

  private final int attempts;

  public RetriesExhaustedException(String operation, int attempts, RateLimitedException lastFailure) {
    super(
        operation,
        RateLimitedException.CODE,
        "Slack " + operation + " still rate limited after " + attempts + " attempts",
        lastFailure);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
