package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import java.util.Optional;

public record SummaryOutcome(SummaryState state, Conversation conversation, DigestSummary summary) {

  static SummaryOutcome empty(Conversation conversation) {
    return new SummaryOutcome(SummaryState.EMPTY, conversation, null);
  }

  static SummaryOutcome persisted(Conversation conversation, DigestSummary summary) {
    return new SummaryOutcome(SummaryState.PERSISTED, conversation, summary);
  }

  /** True when the window held no messages and nothing was stored. */
  public boolean isEmpty() {
    return state == SummaryState.EMPTY;
  }

  public Optional<DigestSummary> summaryIfPersisted() {
    return Optional.ofNullable(summary);
  }
}
