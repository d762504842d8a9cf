package com.chatdigest.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.conversation.store.MessageRecord;
import com.chatdigest.backend.digest.DigestMessageRef;
import com.chatdigest.backend.digest.DigestPoster;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.ingest.IngestionReport;
import com.chatdigest.backend.ingest.IngestionService;
import com.chatdigest.backend.ingest.StoreUnavailableException;
import com.chatdigest.backend.shared.time.SlackTimestamps;
import com.chatdigest.backend.summary.SummaryGenerator;
import com.chatdigest.backend.summary.SummaryOutcome;
import com.chatdigest.backend.summary.SummaryState;
import com.chatdigest.backend.support.InMemoryConversationStore;
import com.chatdigest.backend.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DigestPipelineServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-02T23:00:30Z");
  private static final Instant WINDOW_START = Instant.parse("2024-03-01T23:00:00Z");
  private static final Instant WINDOW_END = Instant.parse("2024-03-02T23:00:00Z");

  @Mock private IngestionService ingestionService;
  @Mock private SummaryGenerator summaryGenerator;
  @Mock private DigestPoster digestPoster;

  private MutableClock clock;
  private InMemoryConversationStore store;
  private DigestProperties properties;
  private DigestPipelineService pipeline;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    store = new InMemoryConversationStore(clock);
    properties = new DigestProperties();
    pipeline =
        new DigestPipelineService(
            ingestionService, summaryGenerator, digestPoster, store, properties, new RunLock(), clock);
  }

  private Conversation conversation(String externalId) {
    return store.upsertConversation(externalId, externalId.toLowerCase(), ConversationKind.CHANNEL);
  }

  private DigestSummary stored(Conversation conversation) {
    return store.createSummary(
        conversation, WINDOW_START, WINDOW_END, "recap", DigestContent.empty(), SummaryOrigin.HEURISTIC);
  }

  private void generates(Conversation conversation) {
    when(summaryGenerator.generate(conversation.getId(), WINDOW_START, WINDOW_END))
        .thenAnswer(
            invocation ->
                new SummaryOutcome(SummaryState.PERSISTED, conversation, stored(conversation)));
  }

  private void generatesNothing(Conversation conversation) {
    when(summaryGenerator.generate(conversation.getId(), WINDOW_START, WINDOW_END))
        .thenReturn(new SummaryOutcome(SummaryState.EMPTY, conversation, null));
  }

  @Test
  void cycleIngestsSummarizesAndPosts() {
    Conversation active = conversation("C1");
    Conversation quiet = conversation("C2");
    Conversation done = conversation("C3");
    stored(done).markPosted("C0DIGEST:1.000000", NOW);
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    when(digestPoster.isConfigured()).thenReturn(true);
    when(digestPoster.post(any())).thenReturn(new DigestMessageRef("C0DIGEST", "2.000000"));
    generates(active);
    generatesNothing(quiet);

    CycleReport report = pipeline.runScheduledCycle();

    assertThat(report.window()).isEqualTo(new SummaryWindow(WINDOW_START, WINDOW_END));
    assertThat(report.summarized()).isEqualTo(1);
    assertThat(report.emptyWindows()).isEqualTo(1);
    assertThat(report.posted()).isEqualTo(1);
    assertThat(report.alreadyHandled()).isEqualTo(1);
    assertThat(report.failed()).isZero();
    assertThat(report.purged()).isZero();
    verify(summaryGenerator, never()).generate(eq(done.getId()), any(), any());
  }

  @Test
  void withoutDigestChannelSummariesAreStoredButNotPosted() {
    Conversation active = conversation("C1");
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    when(digestPoster.isConfigured()).thenReturn(false);
    generates(active);

    CycleReport report = pipeline.runScheduledCycle();

    assertThat(report.summarized()).isEqualTo(1);
    assertThat(report.posted()).isZero();
    verify(digestPoster, never()).post(any());
  }

  @Test
  void unpostedSummaryIsPostedWithoutRegenerating() {
    Conversation active = conversation("C1");
    DigestSummary pending = stored(active);
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    when(digestPoster.isConfigured()).thenReturn(true);
    when(digestPoster.post(pending)).thenReturn(new DigestMessageRef("C0DIGEST", "2.000000"));

    CycleReport report = pipeline.runScheduledCycle();

    assertThat(report.posted()).isEqualTo(1);
    assertThat(report.summarized()).isZero();
    verify(summaryGenerator, never()).generate(any(), any(), any());
  }

  @Test
  void failingConversationDoesNotStopTheCycle() {
    Conversation broken = conversation("C1");
    Conversation healthy = conversation("C2");
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    when(digestPoster.isConfigured()).thenReturn(true);
    when(summaryGenerator.generate(broken.getId(), WINDOW_START, WINDOW_END))
        .thenThrow(new IllegalStateException("boom"));
    generates(healthy);
    when(digestPoster.post(any())).thenReturn(new DigestMessageRef("C0DIGEST", "2.000000"));

    CycleReport report = pipeline.runScheduledCycle();

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.posted()).isEqualTo(1);
  }

  @Test
  void storeOutageAbortsTheCycle() {
    Conversation active = conversation("C1");
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    when(summaryGenerator.generate(active.getId(), WINDOW_START, WINDOW_END))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> pipeline.runScheduledCycle())
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  void retentionPurgesOldMessagesAfterSummarizing() {
    properties.getRetention().setDays(30);
    Conversation active = conversation("C1");
    String ancient = SlackTimestamps.fromInstant(NOW.minus(Duration.ofDays(45)));
    store.upsertMessage(active, new MessageRecord(ancient, "U1", "old", null, Map.of(), List.of(), null));
    when(ingestionService.ingestAll(null)).thenReturn(IngestionReport.empty());
    generatesNothing(active);

    CycleReport report = pipeline.runScheduledCycle();

    assertThat(report.purged()).isEqualTo(1);
    assertThat(store.messages(active)).isEmpty();
  }

  @Test
  void manualEntryPointsDelegate() {
    Conversation active = conversation("C1");
    generatesNothing(active);
    when(ingestionService.ingestAll(NOW)).thenReturn(IngestionReport.empty());

    assertThat(pipeline.runIngestion(NOW)).isEqualTo(IngestionReport.empty());
    assertThat(pipeline.runSummarization(active.getId(), WINDOW_START, WINDOW_END).isEmpty()).isTrue();
    assertThat(pipeline.purgeOlderThan(7)).isZero();
  }

  @Test
  void purgeRejectsNonPositiveRetention() {
    assertThatThrownBy(() -> pipeline.purgeOlderThan(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void summarizationOfUnknownConversationPropagates() {
    UUID missing = UUID.randomUUID();
    when(summaryGenerator.generate(missing, WINDOW_START, WINDOW_END))
        .thenThrow(new IllegalArgumentException("missing"));

    assertThatThrownBy(() -> pipeline.runSummarization(missing, WINDOW_START, WINDOW_END))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
