package com.chatdigest.backend.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.domain.MentionStat;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.conversation.domain.UserRecord;
import com.chatdigest.backend.conversation.store.MessageRecord;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.directory.UserDirectoryService;
import com.chatdigest.backend.extract.TaskHeuristicExtractor;
import com.chatdigest.backend.support.FakeChatPlatformClient;
import com.chatdigest.backend.support.InMemoryConversationStore;
import com.chatdigest.backend.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class SummaryGeneratorTest {

  private static final Instant START = Instant.ofEpochSecond(1_000);
  private static final Instant END = Instant.ofEpochSecond(2_000);

  @Mock private ModelSummarizer modelSummarizer;
  @Mock private ObjectProvider<ModelSummarizer> modelProvider;

  private InMemoryConversationStore store;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private Conversation conversation;
  private DigestProperties properties;
  private UserDirectoryService directory;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
    store = new InMemoryConversationStore(clock);
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newSingleThreadExecutor();
    properties = new DigestProperties();
    conversation = store.upsertConversation("C1", "general", ConversationKind.CHANNEL);
    directory =
        new UserDirectoryService(new FakeChatPlatformClient(), store, properties, clock, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    meterRegistry.close();
  }

  private SummaryGenerator generator(ModelSummarizer model) {
    when(modelProvider.getIfAvailable()).thenReturn(model);
    return new SummaryGenerator(
        store,
        directory,
        new HeuristicSummaryBuilder(new TaskHeuristicExtractor(properties), properties),
        modelProvider,
        meterRegistry);
  }

  private void seed(String ts, String author, String text) {
    store.upsertMessage(
        conversation, new MessageRecord(ts, author, text, null, Map.of(), List.of(), null));
  }

  private double counter(String name, String... tags) {
    return meterRegistry.get(name).tags(tags).counter().count();
  }

  @Test
  void emptyWindowStoresNothing() {
    seed("3000.000000", "U1", "outside the window");

    SummaryOutcome outcome = generator(null).generate(conversation.getId(), START, END);

    assertThat(outcome.isEmpty()).isTrue();
    assertThat(outcome.state()).isEqualTo(SummaryState.EMPTY);
    assertThat(outcome.summaryIfPersisted()).isEmpty();
    assertThat(store.summaries()).isEmpty();
  }

  @Test
  void withoutModelUsesHeuristics() {
    seed("1500.000000", "U1", "is the deploy done?");

    SummaryOutcome outcome = generator(null).generate(conversation.getId(), START, END);

    assertThat(outcome.state()).isEqualTo(SummaryState.PERSISTED);
    DigestSummary summary = outcome.summary();
    assertThat(summary.getOrigin()).isEqualTo(SummaryOrigin.HEURISTIC);
    assertThat(summary.getWindowStart()).isEqualTo(START);
    assertThat(summary.getWindowEnd()).isEqualTo(END);
    assertThat(summary.getRecap()).startsWith("1 message from 1 participant");
    assertThat(store.summaries()).containsExactly(summary);
    assertThat(counter("digest_summary_runs_total", "origin", "heuristic")).isEqualTo(1.0);
  }

  @Test
  void modelDraftIsStoredWhenAvailable() {
    seed("1500.000000", "U1", "ship it");
    when(modelSummarizer.summarize(eq(conversation), anyList(), eq(START), eq(END)))
        .thenReturn(new SummaryDraft("Shipping today.", DigestContent.empty(), SummaryOrigin.MODEL));

    SummaryGenerator generator = generator(modelSummarizer);
    SummaryOutcome outcome = generator.generate(conversation.getId(), START, END);

    assertThat(generator.isModelConfigured()).isTrue();
    assertThat(outcome.summary().getOrigin()).isEqualTo(SummaryOrigin.MODEL);
    assertThat(outcome.summary().getRecap()).isEqualTo("Shipping today.");
    assertThat(counter("digest_summary_runs_total", "origin", "model")).isEqualTo(1.0);
  }

  @Test
  void modelFailureFallsBackToHeuristics() {
    seed("1500.000000", "U1", "ship it");
    when(modelSummarizer.summarize(any(), anyList(), any(), any()))
        .thenThrow(new ModelSummarizationException("Model returned malformed JSON"));

    SummaryOutcome outcome = generator(modelSummarizer).generate(conversation.getId(), START, END);

    assertThat(outcome.summary().getOrigin()).isEqualTo(SummaryOrigin.HEURISTIC);
    assertThat(counter("digest_summary_fallbacks_total")).isEqualTo(1.0);
    assertThat(counter("digest_summary_runs_total", "origin", "heuristic")).isEqualTo(1.0);
  }

  @Test
  void botMentionsAreExcludedFromHeuristicStats() {
    store.upsertUser(new UserRecord("B1", "deploybot", null, null, null, true, false));
    seed("1500.000000", "U1", "<@B1> deploy and <@U2> check");

    SummaryOutcome outcome = generator(null).generate(conversation.getId(), START, END);

    assertThat(outcome.summary().getContent().mentions())
        .extracting(MentionStat::userId)
        .containsExactly("U2");
  }

  @Test
  void unknownConversationIsRejected() {
    UUID missing = UUID.randomUUID();

    assertThatThrownBy(() -> generator(null).generate(missing, START, END))
        .isInstanceOf(ConversationNotFoundException.class)
        .hasMessageContaining(missing.toString());
  }

  @Test
  void invertedWindowIsRejected() {
    assertThatThrownBy(() -> generator(null).generate(conversation.getId(), END, START))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
