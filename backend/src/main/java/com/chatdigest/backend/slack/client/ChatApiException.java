package com.chatdigest.backend.slack.client;

/** Raised when a chat platform call fails with an error that retrying will not fix. */
public class ChatApiException extends RuntimeException {

  private final String operation;
  private final String code;

  public ChatApiException(String operation, String code, String message) {
    super(message);
    this.operation = operation;
    this.code = code;
  }

  public ChatApiException(String operation, String code, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.code = code;
  }

  public String getOperation() {
    return operation;
  }

  public String getCode() {
    return code;
  }
}
