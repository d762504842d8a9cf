package com.chatdigest.backend.conversation.domain;

import java.util.List;

/**
 * Structured part of a summary stored next to the recap text. Both the model and the heuristic
 * summarizers produce this shape. Mentions keep discovery order.
 */
public record DigestContent(
    List<Highlight> highlights, List<ActionItem> tasks, List<MentionStat> mentions) {

  public DigestContent {
    highlights = highlights == null ? List.of() : List.copyOf(highlights);
    tasks = tasks == null ? List.of() : List.copyOf(tasks);
    mentions = mentions == null ? List.of() : List.copyOf(mentions);
  }

  public static DigestContent empty() {
    return new DigestContent(List.of(), List.of(), List.of());
  }
}
