package com.chatdigest.backend.conversation.store;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.domain.DirectoryUser;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.conversation.domain.UserRecord;
import com.chatdigest.backend.conversation.persistence.ConversationMessageRepository;
import com.chatdigest.backend.conversation.persistence.ConversationRepository;
import com.chatdigest.backend.conversation.persistence.DigestSummaryRepository;
import com.chatdigest.backend.conversation.persistence.DirectoryUserRepository;
import com.chatdigest.backend.shared.time.SlackTimestamps;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class JpaConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);

  private final ConversationRepository conversationRepository;
  private final ConversationMessageRepository messageRepository;
  private final DirectoryUserRepository userRepository;
  private final DigestSummaryRepository summaryRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public JpaConversationStore(
      ConversationRepository conversationRepository,
      ConversationMessageRepository messageRepository,
      DirectoryUserRepository userRepository,
      DigestSummaryRepository summaryRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.conversationRepository =
        Objects.requireNonNull(conversationRepository, "conversationRepository must not be null");
    this.messageRepository =
        Objects.requireNonNull(messageRepository, "messageRepository must not be null");
    this.userRepository = Objects.requireNonNull(userRepository, "userRepository must not be null");
    this.summaryRepository =
        Objects.requireNonNull(summaryRepository, "summaryRepository must not be null");
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  @Transactional
  public Conversation upsertConversation(String externalId, String name, ConversationKind kind) {
    Optional<Conversation> existing = conversationRepository.findByExternalId(externalId);
    if (existing.isEmpty()) {
      return conversationRepository.save(new Conversation(externalId, name, kind));
    }
    Conversation conversation = existing.get();
    if (Objects.equals(conversation.getName(), name) && conversation.getKind() == kind) {
      return conversation;
    }
    conversation.setName(name);
    conversation.setKind(kind);
    return conversationRepository.save(conversation);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> findConversation(UUID id) {
    return conversationRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> findByExternalId(String externalId) {
    return conversationRepository.findByExternalId(externalId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Conversation> listConversations() {
    return conversationRepository.findAll();
  }

  @Override
  public UpsertOutcome upsertMessage(Conversation conversation, MessageRecord message) {
    try {
      return transactionTemplate.execute(status -> applyMessage(conversation, message));
    } catch (DataIntegrityViolationException duplicate) {
      log.debug(
          "Message {} in conversation {} was inserted concurrently, retrying as update",
          message.ts(),
          conversation.getExternalId());
      return transactionTemplate.execute(status -> applyMessage(conversation, message));
    }
  }

  private UpsertOutcome applyMessage(Conversation conversation, MessageRecord message) {
    Optional<ConversationMessage> existing =
        messageRepository.findByConversationAndTs(conversation, message.ts());
    if (existing.isEmpty()) {
      ConversationMessage created =
          new ConversationMessage(conversation, message.ts(), SlackTimestamps.toInstant(message.ts()));
      copyInto(created, message);
      messageRepository.saveAndFlush(created);
      return UpsertOutcome.CREATED;
    }
    ConversationMessage stored = existing.get();
    if (!differs(stored, message)) {
      return UpsertOutcome.UNCHANGED;
    }
    copyInto(stored, message);
    messageRepository.save(stored);
    return UpsertOutcome.UPDATED;
  }

  static boolean differs(ConversationMessage stored, MessageRecord message) {
    return !Objects.equals(stored.getAuthorId(), message.authorId())
        || !Objects.equals(stored.getText(), message.text())
        || !Objects.equals(stored.getThreadTs(), message.threadTs())
        || !Objects.equals(stored.getReactions(), message.reactions())
        || !Objects.equals(stored.getMentions(), message.mentions())
        || (message.permalink() != null
            && !Objects.equals(stored.getPermalink(), message.permalink()));
  }

  private static void copyInto(ConversationMessage target, MessageRecord message) {
    target.setAuthorId(message.authorId());
    target.setText(message.text());
    target.setThreadTs(message.threadTs());
    target.setReactions(message.reactions());
    target.setMentions(message.mentions());
    if (message.permalink() != null) {
      target.setPermalink(message.permalink());
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ConversationMessage> findMessage(Conversation conversation, String ts) {
    return messageRepository.findByConversationAndTs(conversation, ts);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ConversationMessage> findMessagesInWindow(
      Conversation conversation, Instant start, Instant end) {
    return messageRepository.findByConversationAndPostedAtBetweenOrderByPostedAtAscTsAsc(
        conversation, start, end);
  }

  @Override
  @Transactional
  public boolean applyReaction(
      String conversationExternalId, String ts, String reaction, String userId) {
    Optional<ConversationMessage> target =
        conversationRepository
            .findByExternalId(conversationExternalId)
            .flatMap(conversation -> messageRepository.findByConversationAndTs(conversation, ts));
    if (target.isEmpty()) {
      return false;
    }
    ConversationMessage message = target.get();
    Map<String, List<String>> reactions = new LinkedHashMap<>(message.getReactions());
    List<String> users = new ArrayList<>(reactions.getOrDefault(reaction, List.of()));
    if (users.contains(userId)) {
      return false;
    }
    users.add(userId);
    reactions.put(reaction, users);
    message.setReactions(reactions);
    messageRepository.save(message);
    return true;
  }

  @Override
  @Transactional
  public Conversation advanceWatermark(Conversation conversation, String ts) {
    Conversation current =
        conversationRepository.findById(conversation.getId()).orElse(conversation);
    String watermark = current.getWatermarkTs();
    if (ts == null || (watermark != null && !SlackTimestamps.isAfter(ts, watermark))) {
      return current;
    }
    current.setWatermarkTs(ts);
    return conversationRepository.save(current);
  }

  @Override
  @Transactional
  public int purgeMessagesOlderThan(Duration age) {
    Instant cutoff = clock.instant().minus(age);
    int removed = messageRepository.deleteByPostedAtBefore(cutoff);
    log.info("Purged {} messages posted before {}", removed, cutoff);
    return removed;
  }

  @Override
  @Transactional
  public DirectoryUser upsertUser(UserRecord user) {
    if (user.placeholder()) {
      throw new IllegalArgumentException("Placeholder users are never persisted: " + user.id());
    }
    DirectoryUser entity =
        userRepository.findByExternalId(user.id()).orElseGet(() -> new DirectoryUser(user.id()));
    entity.setDisplayName(user.displayName());
    entity.setRealName(user.realName());
    entity.setEmail(user.email());
    entity.setAvatarUrl(user.avatarUrl());
    entity.setBot(user.bot());
    entity.setRefreshedAt(clock.instant());
    return userRepository.save(entity);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DirectoryUser> findUsers(Collection<String> externalIds) {
    if (externalIds == null || externalIds.isEmpty()) {
      return List.of();
    }
    return userRepository.findByExternalIdIn(externalIds);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<DigestSummary> latestSummary(
      Conversation conversation, Instant start, Instant end) {
    return summaryRepository.findFirstByConversationAndWindowStartAndWindowEndOrderByCreatedAtDesc(
        conversation, start, end);
  }

  @Override
  @Transactional
  public DigestSummary createSummary(
      Conversation conversation,
      Instant start,
      Instant end,
      String recap,
      DigestContent content,
      SummaryOrigin origin) {
    return summaryRepository.save(new DigestSummary(conversation, start, end, recap, content, origin));
  }

  @Override
  @Transactional
  public DigestSummary markPosted(DigestSummary summary, String postedRef) {
    summary.markPosted(postedRef, clock.instant());
    return summaryRepository.save(summary);
  }
}
