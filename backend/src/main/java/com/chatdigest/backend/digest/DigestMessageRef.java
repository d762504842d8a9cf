package com.chatdigest.backend.digest;

/** Location of a posted digest message. */
public record DigestMessageRef(String channel, String ts) {

  /** Compact form stored on the summary row. */
  public String asReference() {
    return channel + ":" + ts;
  }
}
