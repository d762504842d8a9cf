package com.chatdigest.backend.slack.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Message as returned by history or replies listings. {@code reactions} maps a reaction name to the
 * ids of users who added it.
 */
public record PlatformMessage(
    String ts,
    String user,
    String text,
    String threadTs,
    int replyCount,
    Map<String, List<String>> reactions,
    String subtype) {

  public PlatformMessage {
    reactions = reactions == null ? Map.of() : copyReactions(reactions);
  }

  public boolean hasAuthor() {
    return StringUtils.hasText(user);
  }

  public boolean isReply() {
    return StringUtils.hasText(threadTs) && !threadTs.equals(ts);
  }

  /** Timestamp of the top-level message this one belongs to: its thread root, or itself. */
  public String topLevelTs() {
    return isReply() ? threadTs : ts;
  }

  private static Map<String, List<String>> copyReactions(Map<String, List<String>> source) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    source.forEach((name, users) -> copy.put(name, users == null ? List.of() : List.copyOf(users)));
    return copy;
  }
}
