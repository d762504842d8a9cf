package com.chatdigest.backend.conversation.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Values written by a message upsert. {@code permalink} may be {@code null} when not resolved. */
public record MessageRecord(
    String ts,
    String authorId,
    String text,
    String threadTs,
    Map<String, List<String>> reactions,
    List<String> mentions,
    String permalink) {

  public MessageRecord {
    if (ts == null || ts.isBlank()) {
      throw new IllegalArgumentException("ts must not be blank");
    }
    reactions = reactions == null ? Map.of() : new LinkedHashMap<>(reactions);
    mentions = mentions == null ? List.of() : List.copyOf(mentions);
  }
}
