package com.chatdigest.backend.conversation.domain;

import java.util.List;

public record MentionStat(String userId, int count, List<String> contexts) {

  public MentionStat {
    contexts = contexts == null ? List.of() : List.copyOf(contexts);
  }
}
