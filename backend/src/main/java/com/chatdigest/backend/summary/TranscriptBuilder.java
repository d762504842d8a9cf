package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.ConversationMessage;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/** Renders stored messages as the plain-text transcript handed to the model. */
final class TranscriptBuilder {

  private static final DateTimeFormatter TIME = DateTimeFormatter.ISO_INSTANT;

  private TranscriptBuilder() {}

  static String build(List<ConversationMessage> messages) {
    StringBuilder transcript = new StringBuilder();
    for (ConversationMessage message : messages) {
      transcript.append('[').append(TIME.format(message.getPostedAt())).append("] ");
      transcript.append("(ts=").append(message.getTs()).append(") ");
      if (message.isThreadRoot()) {
        transcript.append("[THREAD_START] ");
      } else if (StringUtils.hasText(message.getThreadTs())) {
        transcript.append("[REPLY to ").append(message.getThreadTs()).append("] ");
      }
      transcript.append("<@").append(message.getAuthorId()).append(">: ");
      transcript.append(message.getText() == null ? "" : message.getText().strip());
      String reactions = describeReactions(message.getReactions());
      if (!reactions.isEmpty()) {
        transcript.append(" {reactions: ").append(reactions).append('}');
      }
      transcript.append('\n');
    }
    return transcript.toString();
  }

  private static String describeReactions(Map<String, List<String>> reactions) {
    if (reactions == null || reactions.isEmpty()) {
      return "";
    }
    return reactions.entrySet().stream()
        .map(entry -> ":" + entry.getKey() + ": x" + entry.getValue().size())
        .collect(Collectors.joining(", "));
  }
}
