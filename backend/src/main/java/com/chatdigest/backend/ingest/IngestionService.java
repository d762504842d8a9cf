package com.chatdigest.backend.ingest;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.store.ConversationStore;
import com.chatdigest.backend.conversation.store.MessageRecord;
import com.chatdigest.backend.conversation.store.UpsertOutcome;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.directory.UserDirectoryService;
import com.chatdigest.backend.extract.MentionExtractor;
import com.chatdigest.backend.shared.time.Sleeper;
import com.chatdigest.backend.shared.time.SlackTimestamps;
import com.chatdigest.backend.slack.client.ChatApiException;
import com.chatdigest.backend.slack.client.ChatPlatformClient;
import com.chatdigest.backend.slack.client.CursorPage;
import com.chatdigest.backend.slack.client.PlatformConversation;
import com.chatdigest.backend.slack.client.PlatformMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.util.StringUtils;

/**
 * Pulls conversation history from the platform into the store. Each conversation resumes from its
 * watermark, threads are backfilled once per root, and the watermark only moves past messages
 * that were persisted, so a failed message is picked up again by the next run.
 *
 * <p>Threads are backfilled only for roots returned by the current history page. A reply posted
 * later to a root already behind the watermark reaches the store through {@link #ingestEvent}.
 */
@Service
@Slf4j
public class IngestionService {

  private final ChatPlatformClient platformClient;
  private final ConversationStore store;
  private final UserDirectoryService directory;
  private final Sleeper sleeper;
  private final DigestProperties.Ingestion properties;

  public IngestionService(
      ChatPlatformClient platformClient,
      ConversationStore store,
      UserDirectoryService directory,
      DigestProperties properties,
      Sleeper sleeper) {
    this.platformClient = Objects.requireNonNull(platformClient, "platformClient must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.directory = Objects.requireNonNull(directory, "directory must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.properties = properties.getIngestion();
  }

  /**
   * Ingests every visible conversation.
   *
   * @param since optional lower bound; the effective bound per conversation is the later of this
   *     and the stored watermark
   */
  public IngestionReport ingestAll(Instant since) {
    if (properties.isPreloadDirectory()) {
      preloadDirectory();
    }
    List<PlatformConversation> conversations = listConversations();
    log.info("Ingesting {} conversations", conversations.size());
    IngestionReport report = IngestionReport.empty();
    for (int index = 0; index < conversations.size(); index++) {
      if (index > 0) {
        pause(properties.getInterConversationDelay());
      }
      PlatformConversation conversation = conversations.get(index);
      report = report.plus(ingestIsolated(conversation, since));
    }
    log.info(
        "Ingestion finished: {} conversations ({} skipped), {} messages ({} new, {} updated, {} failed)",
        report.conversationsSeen(),
        report.conversationsSkipped(),
        report.messagesProcessed(),
        report.messagesCreated(),
        report.messagesUpdated(),
        report.messagesFailed());
    return report;
  }

  private IngestionReport ingestIsolated(PlatformConversation conversation, Instant since) {
    try {
      return ingestConversation(conversation, since);
    } catch (StoreUnavailableException exception) {
      throw exception;
    } catch (DataAccessResourceFailureException | CannotCreateTransactionException exception) {
      throw new StoreUnavailableException(exception);
    } catch (RuntimeException exception) {
      log.warn(
          "Skipping conversation {} ({}) after failure: {}",
          conversation.name(),
          conversation.id(),
          exception.getMessage(),
          exception);
      return IngestionReport.skipped();
    }
  }

  IngestionReport ingestConversation(PlatformConversation listed, Instant since) {
    Optional<PlatformConversation> accessible = platformClient.conversationInfo(listed.id());
    if (accessible.isEmpty()) {
      log.info("Conversation {} ({}) is not accessible, skipping", listed.name(), listed.id());
      return IngestionReport.skipped();
    }
    PlatformConversation info = accessible.get();
    Conversation conversation = store.upsertConversation(info.id(), info.name(), info.kind());
    String sinceTs = since == null ? null : SlackTimestamps.fromInstant(since);
    String oldest = SlackTimestamps.max(sinceTs, conversation.getWatermarkTs());

    List<PlatformMessage> history = fetchAll(cursor -> platformClient.history(info.id(), oldest, cursor));
    Map<String, PlatformMessage> merged = new TreeMap<>(SlackTimestamps.ORDER);
    history.forEach(message -> merged.put(message.ts(), message));
    backfillThreads(info.id(), history, merged);

    int created = 0;
    int updated = 0;
    int unchanged = 0;
    int failed = 0;
    String cap = null;
    for (PlatformMessage message : merged.values()) {
      if (!message.hasAuthor()) {
        continue;
      }
      try {
        UpsertOutcome outcome = store.upsertMessage(conversation, toRecord(info.id(), message));
        switch (outcome) {
          case CREATED -> created++;
          case UPDATED -> updated++;
          case UNCHANGED -> unchanged++;
          default -> throw new IllegalStateException("Unexpected outcome " + outcome);
        }
      } catch (DataAccessResourceFailureException | CannotCreateTransactionException exception) {
        throw new StoreUnavailableException(exception);
      } catch (RuntimeException exception) {
        failed++;
        String topLevel = message.topLevelTs();
        cap = cap == null || SlackTimestamps.compare(topLevel, cap) < 0 ? topLevel : cap;
        log.warn(
            "Failed to persist message {} in {}: {}",
            message.ts(),
            info.id(),
            exception.getMessage());
      }
    }

    String watermark = nextWatermark(history, cap);
    if (watermark != null) {
      store.advanceWatermark(conversation, watermark);
    }
    log.debug(
        "Conversation {}: {} messages since {}, watermark {}",
        info.id(),
        merged.size(),
        oldest,
        watermark);
    return new IngestionReport(1, 1, 0, merged.size(), created, updated, unchanged, failed);
  }

  /**
   * Persists a single message delivered by the event layer. For replies the thread root is
   * refreshed as well so its reply metadata stays current. The watermark is left alone.
   */
  public Optional<UpsertOutcome> ingestEvent(String conversationId, PlatformMessage message) {
    Optional<Conversation> known = store.findByExternalId(conversationId);
    Conversation conversation;
    if (known.isPresent()) {
      conversation = known.get();
    } else {
      Optional<PlatformConversation> info = platformClient.conversationInfo(conversationId);
      if (info.isEmpty()) {
        log.info("Ignoring event for inaccessible conversation {}", conversationId);
        return Optional.empty();
      }
      conversation = store.upsertConversation(info.get().id(), info.get().name(), info.get().kind());
    }
    if (!message.hasAuthor()) {
      return Optional.empty();
    }
    if (message.isReply()) {
      refreshThreadRoot(conversation, conversationId, message.threadTs());
    }
    return Optional.of(store.upsertMessage(conversation, toRecord(conversationId, message)));
  }

  /** Records a reaction on an already stored message. Unknown targets are ignored. */
  public boolean applyReaction(String conversationId, String ts, String reaction, String userId) {
    boolean applied = store.applyReaction(conversationId, ts, reaction, userId);
    if (!applied) {
      log.debug("Reaction {} on {}/{} not applied", reaction, conversationId, ts);
    }
    return applied;
  }

  private void refreshThreadRoot(Conversation conversation, String conversationId, String threadTs) {
    try {
      platformClient.replies(conversationId, threadTs, null).items().stream()
          .filter(candidate -> threadTs.equals(candidate.ts()) && candidate.hasAuthor())
          .findFirst()
          .ifPresent(root -> store.upsertMessage(conversation, toRecord(conversationId, root)));
    } catch (ChatApiException exception) {
      log.warn("Could not refresh thread root {} in {}: {}", threadTs, conversationId, exception.getMessage());
    }
  }

  private void backfillThreads(
      String conversationId, List<PlatformMessage> history, Map<String, PlatformMessage> merged) {
    Set<String> fetchedThreads = new HashSet<>();
    for (PlatformMessage message : history) {
      String root = message.threadTs();
      if (!StringUtils.hasText(root) || !fetchedThreads.add(root)) {
        continue;
      }
      List<PlatformMessage> replies =
          fetchAll(cursor -> platformClient.replies(conversationId, root, cursor));
      for (PlatformMessage reply : replies) {
        if (!root.equals(reply.ts())) {
          merged.putIfAbsent(reply.ts(), reply);
        }
      }
    }
  }

  private MessageRecord toRecord(String conversationId, PlatformMessage message) {
    Set<String> mentions = MentionExtractor.extractMentions(message.text());
    Set<String> people = new LinkedHashSet<>();
    people.add(message.user());
    people.addAll(mentions);
    directory.resolveAll(people);
    return new MessageRecord(
        message.ts(),
        message.user(),
        message.text(),
        message.threadTs(),
        message.reactions(),
        new ArrayList<>(mentions),
        resolvePermalink(conversationId, message.ts()));
  }

  private String resolvePermalink(String conversationId, String ts) {
    if (!properties.isResolvePermalinks()) {
      return null;
    }
    try {
      return platformClient.permalink(conversationId, ts);
    } catch (ChatApiException exception) {
      log.debug("No permalink for {}/{}: {}", conversationId, ts, exception.getMessage());
      return null;
    }
  }

  /** Newest top-level history timestamp strictly below {@code cap} (no cap when {@code null}). */
  static String nextWatermark(List<PlatformMessage> history, String cap) {
    String watermark = null;
    for (PlatformMessage message : history) {
      if (message.isReply()) {
        continue;
      }
      if (cap != null && SlackTimestamps.compare(message.ts(), cap) >= 0) {
        continue;
      }
      watermark = SlackTimestamps.max(watermark, message.ts());
    }
    return watermark;
  }

  private List<PlatformConversation> listConversations() {
    return fetchAll(platformClient::listConversations);
  }

  private void preloadDirectory() {
    try {
      directory.preloadDirectory();
    } catch (ChatApiException exception) {
      log.warn("Directory preload failed, users will be resolved lazily: {}", exception.getMessage());
    }
  }

  private static <T> List<T> fetchAll(Function<String, CursorPage<T>> pageFetcher) {
    List<T> items = new ArrayList<>();
    String cursor = null;
    do {
      CursorPage<T> page = pageFetcher.apply(cursor);
      items.addAll(page.items());
      cursor = page.nextCursor();
    } while (StringUtils.hasText(cursor));
    return items;
  }

  private void pause(Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Ingestion interrupted", exception);
    }
  }
}
