package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.ActionItem;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.Highlight;
import com.chatdigest.backend.conversation.domain.MentionStat;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.extract.MentionExtractor;
import com.chatdigest.backend.extract.TaskHeuristicExtractor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Summary path that needs no model: statistics, notable messages, pattern-matched tasks. */
@Component
public class HeuristicSummaryBuilder {

  private static final int KEY_MESSAGE_TEXT_LIMIT = 100;

  private final TaskHeuristicExtractor taskExtractor;
  private final int highlightLimit;
  private final int mentionContextLimit;
  private final int mentionContextLength;

  public HeuristicSummaryBuilder(TaskHeuristicExtractor taskExtractor, DigestProperties properties) {
    this.taskExtractor = Objects.requireNonNull(taskExtractor, "taskExtractor must not be null");
    this.highlightLimit = properties.getSummary().getHighlightLimit();
    this.mentionContextLimit = properties.getSummary().getMentionContextLimit();
    this.mentionContextLength = properties.getSummary().getMentionContextLength();
  }

  public SummaryDraft build(List<ConversationMessage> messages, Set<String> botIds) {
    List<Highlight> highlights = highlights(messages);
    List<ActionItem> tasks = new ArrayList<>();
    for (ConversationMessage message : messages) {
      tasks.addAll(
          taskExtractor.extract(message.getText(), message.getTs(), message.getPermalink(), botIds));
    }
    DigestContent content = new DigestContent(highlights, tasks, mentions(messages, botIds));
    return new SummaryDraft(recap(messages, highlights), content, SummaryOrigin.HEURISTIC);
  }

  private List<Highlight> highlights(List<ConversationMessage> messages) {
    List<Highlight> highlights = new ArrayList<>();
    for (ConversationMessage message : messages) {
      if (highlights.size() >= highlightLimit) {
        break;
      }
      String reason = highlightReason(message);
      if (reason != null) {
        highlights.add(
            new Highlight(
                message.getTs(),
                message.getAuthorId(),
                message.getText(),
                message.getPermalink(),
                reason));
      }
    }
    return highlights;
  }

  private static String highlightReason(ConversationMessage message) {
    if (message.getReactions() != null && !message.getReactions().isEmpty()) {
      return "reactions";
    }
    if (message.isThreadRoot()) {
      return "thread";
    }
    if (message.getText() != null && message.getText().contains("?")) {
      return "question";
    }
    return null;
  }

  private static String recap(List<ConversationMessage> messages, List<Highlight> highlights) {
    Set<String> participants = new LinkedHashSet<>();
    Set<String> threads = new LinkedHashSet<>();
    for (ConversationMessage message : messages) {
      if (StringUtils.hasText(message.getAuthorId())) {
        participants.add(message.getAuthorId());
      }
      if (StringUtils.hasText(message.getThreadTs())) {
        threads.add(message.getThreadTs());
      }
    }
    StringBuilder recap =
        new StringBuilder()
            .append(messages.size())
            .append(messages.size() == 1 ? " message" : " messages")
            .append(" from ")
            .append(participants.size())
            .append(participants.size() == 1 ? " participant" : " participants")
            .append(" across ")
            .append(threads.size())
            .append(threads.size() == 1 ? " thread." : " threads.");
    if (!highlights.isEmpty()) {
      recap.append("\nKey messages:");
      for (Highlight highlight : highlights) {
        recap
            .append("\n• <@")
            .append(highlight.authorId())
            .append(">: ")
            .append(truncate(collapse(highlight.text()), KEY_MESSAGE_TEXT_LIMIT));
      }
    }
    return recap.toString();
  }

  private List<MentionStat> mentions(List<ConversationMessage> messages, Set<String> botIds) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    Map<String, List<String>> contexts = new LinkedHashMap<>();
    for (ConversationMessage message : messages) {
      for (String userId : MentionExtractor.extractMentions(message.getText())) {
        if (botIds.contains(userId)) {
          continue;
        }
        counts.merge(userId, 1, Integer::sum);
        List<String> snippets = contexts.computeIfAbsent(userId, key -> new ArrayList<>());
        if (snippets.size() < mentionContextLimit) {
          snippets.add(truncate(collapse(message.getText()), mentionContextLength));
        }
      }
    }
    List<MentionStat> stats = new ArrayList<>();
    counts.forEach((userId, count) -> stats.add(new MentionStat(userId, count, contexts.get(userId))));
    return stats;
  }

  private static String collapse(String text) {
    return text == null ? "" : text.replaceAll("\\s+", " ").trim();
  }

  static String truncate(String text, int limit) {
    return text.length() <= limit ? text : text.substring(0, limit) + "...";
  }
}
