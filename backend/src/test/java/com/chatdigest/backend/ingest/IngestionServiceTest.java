package com.chatdigest.backend.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.store.UpsertOutcome;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.directory.UserDirectoryService;
import com.chatdigest.backend.slack.client.PlatformMessage;
import com.chatdigest.backend.slack.client.PlatformUser;
import com.chatdigest.backend.support.FakeChatPlatformClient;
import com.chatdigest.backend.support.InMemoryConversationStore;
import com.chatdigest.backend.support.MutableClock;
import com.chatdigest.backend.support.RecordingSleeper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class IngestionServiceTest {

  private MutableClock clock;
  private FakeChatPlatformClient platform;
  private InMemoryConversationStore store;
  private RecordingSleeper sleeper;
  private ExecutorService executor;
  private DigestProperties properties;
  private IngestionService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
    platform = new FakeChatPlatformClient();
    platform.user(new PlatformUser("U1", "alice", "Alice", "alice", null, null, false, false));
    platform.user(new PlatformUser("U2", "bob", "Bob", "bob", null, null, false, false));
    store = new InMemoryConversationStore(clock);
    sleeper = new RecordingSleeper();
    executor = Executors.newFixedThreadPool(2);
    properties = new DigestProperties();
    service = newService(store);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private IngestionService newService(InMemoryConversationStore backingStore) {
    UserDirectoryService directory =
        new UserDirectoryService(platform, backingStore, properties, clock, executor);
    return new IngestionService(platform, backingStore, directory, properties, sleeper);
  }

  private Conversation conversation(String externalId) {
    return store.findByExternalId(externalId).orElseThrow();
  }

  @Test
  void ingestsHistoryWithThreadRepliesAndAdvancesWatermark() {
    platform
        .conversation("C1", "general")
        .message("C1", "100.000100", "U1", "kickoff <@U2>")
        .message("C1", "100.000300", "U1", "done")
        .reply("C1", "100.000100", "100.000200", "U2", "on it");

    IngestionReport report = service.ingestAll(null);

    Conversation general = conversation("C1");
    List<ConversationMessage> messages = store.messages(general);
    assertThat(messages)
        .extracting(ConversationMessage::getTs)
        .containsExactly("100.000100", "100.000200", "100.000300");
    assertThat(messages.get(0).isThreadRoot()).isTrue();
    assertThat(messages.get(0).getMentions()).containsExactly("U2");
    assertThat(messages.get(1).getThreadTs()).isEqualTo("100.000100");
    assertThat(messages.get(1).getPermalink()).endsWith("/p100000200");
    assertThat(general.getWatermarkTs()).isEqualTo("100.000300");
    assertThat(report.conversationsIngested()).isEqualTo(1);
    assertThat(report.messagesCreated()).isEqualTo(3);
    assertThat(report.messagesFailed()).isZero();
  }

  @Test
  void secondRunResumesFromWatermark() {
    platform
        .conversation("C1", "general")
        .message("C1", "100.000100", "U1", "first")
        .message("C1", "100.000300", "U1", "second");
    service.ingestAll(null);
    platform.message("C1", "100.000400", "U2", "third");

    IngestionReport report = service.ingestAll(null);

    assertThat(platform.historyOldest()).containsExactly(null, "100.000300");
    assertThat(report.messagesCreated()).isEqualTo(1);
    assertThat(report.messagesProcessed()).isEqualTo(1);
    assertThat(conversation("C1").getWatermarkTs()).isEqualTo("100.000400");
  }

  @Test
  void sinceBoundWinsWhenNewerThanWatermark() {
    platform
        .conversation("C1", "general")
        .message("C1", "100.000000", "U1", "old")
        .message("C1", "200.000000", "U1", "new");

    service.ingestAll(Instant.ofEpochSecond(150));

    assertThat(platform.historyOldest()).containsExactly("150.000000");
    assertThat(store.messages(conversation("C1")))
        .extracting(ConversationMessage::getText)
        .containsExactly("new");
  }

  @Test
  void failingConversationDoesNotStopOthers() {
    platform
        .conversation("C1", "broken")
        .conversation("C2", "healthy")
        .message("C2", "100.000100", "U1", "still here")
        .failHistory("C1");

    IngestionReport report = service.ingestAll(null);

    assertThat(report.conversationsSeen()).isEqualTo(2);
    assertThat(report.conversationsSkipped()).isEqualTo(1);
    assertThat(report.conversationsIngested()).isEqualTo(1);
    assertThat(store.messages(conversation("C2"))).hasSize(1);
    assertThat(conversation("C1").getWatermarkTs()).isNull();
    assertThat(sleeper.sleeps()).containsExactly(properties.getIngestion().getInterConversationDelay());
  }

  @Test
  void inaccessibleConversationIsSkipped() {
    platform.conversation("C1", "gone").message("C1", "1.000000", "U1", "hi").inaccessible("C1");

    IngestionReport report = service.ingestAll(null);

    assertThat(report.conversationsSkipped()).isEqualTo(1);
    assertThat(store.findByExternalId("C1")).isEmpty();
  }

  @Test
  void failedMessageHoldsWatermarkBackUntilRetried() {
    platform
        .conversation("C1", "general")
        .message("C1", "10.000000", "U1", "one")
        .message("C1", "20.000000", "U1", "two")
        .message("C1", "30.000000", "U1", "three");
    store.failMessagesWhen(message -> message.ts().equals("20.000000"));

    IngestionReport first = service.ingestAll(null);

    assertThat(first.messagesFailed()).isEqualTo(1);
    assertThat(conversation("C1").getWatermarkTs()).isEqualTo("10.000000");

    store.failMessagesWhen(message -> false);
    IngestionReport second = service.ingestAll(null);

    assertThat(platform.historyOldest()).containsExactly(null, "10.000000");
    assertThat(second.messagesCreated()).isEqualTo(1);
    assertThat(second.messagesUnchanged()).isEqualTo(1);
    assertThat(conversation("C1").getWatermarkTs()).isEqualTo("30.000000");
  }

  @Test
  void authorlessMessagesAreCountedButNotStored() {
    platform
        .conversation("C1", "general")
        .message("C1", "1.000000", null, "channel joined")
        .message("C1", "2.000000", "U1", "hello");

    IngestionReport report = service.ingestAll(null);

    assertThat(report.messagesProcessed()).isEqualTo(2);
    assertThat(store.messages(conversation("C1")))
        .extracting(ConversationMessage::getTs)
        .containsExactly("2.000000");
  }

  @Test
  void followsCursorsAcrossPages() {
    platform.pageSize(2).conversation("C1", "general");
    for (int i = 1; i <= 5; i++) {
      platform.message("C1", i + ".000000", "U1", "message " + i);
    }

    IngestionReport report = service.ingestAll(null);

    assertThat(report.messagesCreated()).isEqualTo(5);
    assertThat(conversation("C1").getWatermarkTs()).isEqualTo("5.000000");
  }

  @Test
  void threadIsFetchedOncePerRoot() {
    platform
        .conversation("C1", "general")
        .message("C1", "1.000000", "U1", "root")
        .reply("C1", "1.000000", "2.000000", "U2", "a")
        .reply("C1", "1.000000", "3.000000", "U1", "b");

    service.ingestAll(null);

    assertThat(platform.repliesCalls()).isEqualTo(1);
    assertThat(store.messages(conversation("C1"))).hasSize(3);
  }

  @Test
  void storeOutageAbortsTheRun() {
    InMemoryConversationStore broken =
        new InMemoryConversationStore(clock) {
          @Override
          public Conversation upsertConversation(
              String externalId, String name, ConversationKind kind) {
            throw new DataAccessResourceFailureException("connection refused");
          }
        };
    platform.conversation("C1", "general").conversation("C2", "random");

    assertThatThrownBy(() -> newService(broken).ingestAll(null))
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  void eventReplyRefreshesRootAndLeavesWatermarkAlone() {
    platform
        .conversation("C1", "general")
        .message("C1", "100.000100", "U1", "root")
        .reply("C1", "100.000100", "100.000200", "U2", "reply");
    PlatformMessage event =
        new PlatformMessage("100.000200", "U2", "reply", "100.000100", 0, Map.of(), null);

    Optional<UpsertOutcome> outcome = service.ingestEvent("C1", event);

    assertThat(outcome).contains(UpsertOutcome.CREATED);
    Conversation general = conversation("C1");
    assertThat(store.messages(general))
        .extracting(ConversationMessage::getTs)
        .containsExactly("100.000100", "100.000200");
    assertThat(general.getWatermarkTs()).isNull();
  }

  @Test
  void eventForInaccessibleConversationIsIgnored() {
    platform.conversation("C9", "secret").inaccessible("C9");

    Optional<UpsertOutcome> outcome =
        service.ingestEvent(
            "C9", new PlatformMessage("1.000000", "U1", "hi", null, 0, Map.of(), null));

    assertThat(outcome).isEmpty();
  }

  @Test
  void reactionsOnUnknownMessagesAreIgnored() {
    platform.conversation("C1", "general").message("C1", "1.000000", "U1", "ship it");
    service.ingestAll(null);

    assertThat(service.applyReaction("C1", "1.000000", "rocket", "U2")).isTrue();
    assertThat(service.applyReaction("C1", "9.000000", "rocket", "U2")).isFalse();
    assertThat(store.findMessage(conversation("C1"), "1.000000").orElseThrow().getReactions())
        .containsEntry("rocket", List.of("U2"));
  }

  @Test
  void nextWatermarkIgnoresRepliesAndRespectsCap() {
    List<PlatformMessage> history =
        List.of(
            new PlatformMessage("5.000000", "U1", "a", null, 0, Map.of(), null),
            new PlatformMessage("9.000000", "U1", "b", "4.000000", 0, Map.of(), null),
            new PlatformMessage("7.000000", "U1", "c", "7.000000", 1, Map.of(), null));

    assertThat(IngestionService.nextWatermark(history, null)).isEqualTo("7.000000");
    assertThat(IngestionService.nextWatermark(history, "7.000000")).isEqualTo("5.000000");
    assertThat(IngestionService.nextWatermark(List.of(), null)).isNull();
  }

  @Test
  void interConversationDelayIsConfigurable() {
    properties.getIngestion().setInterConversationDelay(Duration.ofMillis(10));
    service = newService(store);
    platform.conversation("C1", "a").conversation("C2", "b").conversation("C3", "c");

    service.ingestAll(null);

    assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(10));
  }
}
