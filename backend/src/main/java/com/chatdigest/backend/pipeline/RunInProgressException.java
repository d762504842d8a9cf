package com.chatdigest.backend.pipeline;

public class RunInProgressException extends RuntimeException {

  public RunInProgressException(String requested, String active) {
    super(
        "Cannot start "
            + requested
            + ": "
            + (active != null ? active : "another run")
            + " is still in progress");
  }
}
