package com.chatdigest.backend.conversation.store;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.domain.DirectoryUser;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.conversation.domain.UserRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for conversations, messages, directory users and summaries. Every write is
 * idempotent: repeating an upsert with identical values leaves the store untouched.
 */
public interface ConversationStore {

  Conversation upsertConversation(String externalId, String name, ConversationKind kind);

  Optional<Conversation> findConversation(UUID id);

  Optional<Conversation> findByExternalId(String externalId);

  List<Conversation> listConversations();

  /** Inserts or updates the message keyed by (conversation, ts). */
  UpsertOutcome upsertMessage(Conversation conversation, MessageRecord message);

  Optional<ConversationMessage> findMessage(Conversation conversation, String ts);

  /** Messages posted within [start, end], oldest first. */
  List<ConversationMessage> findMessagesInWindow(Conversation conversation, Instant start, Instant end);

  /**
   * Adds {@code userId} to the users of {@code reaction} on a stored message. Returns {@code false}
   * when the conversation or message is unknown or the reaction was already recorded.
   */
  boolean applyReaction(String conversationExternalId, String ts, String reaction, String userId);

  /** Moves the watermark forward to {@code ts}. Older values are ignored. */
  Conversation advanceWatermark(Conversation conversation, String ts);

  /** Deletes messages posted before {@code now - age}; returns the number removed. */
  int purgeMessagesOlderThan(Duration age);

  DirectoryUser upsertUser(UserRecord user);

  List<DirectoryUser> findUsers(Collection<String> externalIds);

  Optional<DigestSummary> latestSummary(Conversation conversation, Instant start, Instant end);

  DigestSummary createSummary(
      Conversation conversation,
      Instant start,
      Instant end,
      String recap,
      DigestContent content,
      SummaryOrigin origin);

  DigestSummary markPosted(DigestSummary summary, String postedRef);
}
