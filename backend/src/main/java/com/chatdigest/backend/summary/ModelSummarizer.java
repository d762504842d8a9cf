package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import java.time.Instant;
import java.util.List;

public interface ModelSummarizer {

  /**
   * Summarizes {@code messages}, which all fall inside [start, end].
   *
   * @throws ModelSummarizationException when the model fails or returns an unusable payload
   */
  SummaryDraft summarize(
      Conversation conversation, List<ConversationMessage> messages, Instant start, Instant end);
}
