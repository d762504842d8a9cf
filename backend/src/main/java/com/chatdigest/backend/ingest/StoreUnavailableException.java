package com.chatdigest.backend.ingest;

/** The relational store cannot be reached; the whole run is aborted and retried on the next trigger. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(Throwable cause) {
    super("Conversation store unavailable: " + cause.getMessage(), cause);
  }
}
