package com.chatdigest.backend.digest;

public class DigestNotConfiguredException extends RuntimeException {

  public DigestNotConfiguredException() {
    super("No digest channel configured (app.digest.posting.channel)");
  }
}
