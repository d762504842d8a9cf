package com.chatdigest.backend.pipeline;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.store.ConversationStore;
import com.chatdigest.backend.digest.DigestPoster;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.ingest.IngestionReport;
import com.chatdigest.backend.ingest.IngestionService;
import com.chatdigest.backend.ingest.StoreUnavailableException;
import com.chatdigest.backend.summary.SummaryGenerator;
import com.chatdigest.backend.summary.SummaryOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Entry points of the digest pipeline. All of them share one {@link RunLock}, so an ingestion,
 * summarization, purge or full cycle never overlaps another.
 */
@Service
@Slf4j
public class DigestPipelineService {

  private final IngestionService ingestionService;
  private final SummaryGenerator summaryGenerator;
  private final DigestPoster digestPoster;
  private final ConversationStore store;
  private final DigestProperties properties;
  private final RunLock runLock;
  private final Clock clock;

  public DigestPipelineService(
      IngestionService ingestionService,
      SummaryGenerator summaryGenerator,
      DigestPoster digestPoster,
      ConversationStore store,
      DigestProperties properties,
      RunLock runLock,
      Clock clock) {
    this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService must not be null");
    this.summaryGenerator = Objects.requireNonNull(summaryGenerator, "summaryGenerator must not be null");
    this.digestPoster = Objects.requireNonNull(digestPoster, "digestPoster must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.runLock = Objects.requireNonNull(runLock, "runLock must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public IngestionReport runIngestion(Instant since) {
    return runLock.runExclusive("ingestion", () -> ingestionService.ingestAll(since));
  }

  public SummaryOutcome runSummarization(UUID conversationId, Instant start, Instant end) {
    return runLock.runExclusive(
        "summarization", () -> summaryGenerator.generate(conversationId, start, end));
  }

  public int purgeOlderThan(int days) {
    if (days < 1) {
      throw new IllegalArgumentException("Retention must be at least one day, got " + days);
    }
    return runLock.runExclusive(
        "purge", () -> store.purgeMessagesOlderThan(Duration.ofDays(days)));
  }

  public CycleReport runScheduledCycle() {
    return runLock.runExclusive("scheduled cycle", this::cycle);
  }

  private CycleReport cycle() {
    Instant now = clock.instant();
    IngestionReport ingestion = ingestionService.ingestAll(null);
    SummaryWindow window =
        SummaryWindow.lastClosed(
            now, properties.getSummary().getWindow(), properties.getSchedule().zoneId());
    if (!digestPoster.isConfigured()) {
      log.info("No digest channel configured, summaries will be stored but not posted");
    }

    int summarized = 0;
    int empty = 0;
    int posted = 0;
    int alreadyHandled = 0;
    int failed = 0;
    for (Conversation conversation : store.listConversations()) {
      try {
        Optional<DigestSummary> existing =
            store.latestSummary(conversation, window.start(), window.end());
        DigestSummary summary;
        if (existing.isPresent()) {
          if (existing.get().isPosted() || !digestPoster.isConfigured()) {
            alreadyHandled++;
            continue;
          }
          summary = existing.get();
        } else {
          SummaryOutcome outcome =
              summaryGenerator.generate(conversation.getId(), window.start(), window.end());
          if (outcome.isEmpty()) {
            empty++;
            continue;
          }
          summary = outcome.summary();
          summarized++;
        }
        if (digestPoster.isConfigured()) {
          digestPoster.post(summary);
          posted++;
        }
      } catch (StoreUnavailableException exception) {
        throw exception;
      } catch (DataAccessResourceFailureException | CannotCreateTransactionException exception) {
        throw new StoreUnavailableException(exception);
      } catch (RuntimeException exception) {
        failed++;
        log.warn(
            "Digest for #{} failed: {}", conversation.getName(), exception.getMessage(), exception);
      }
    }

    int purged = 0;
    DigestProperties.Retention retention = properties.getRetention();
    if (retention.isEnabled()) {
      purged = store.purgeMessagesOlderThan(Duration.ofDays(retention.getDays()));
    }
    CycleReport report =
        new CycleReport(ingestion, window, summarized, empty, posted, alreadyHandled, failed, purged);
    log.info(
        "Digest cycle for {} .. {}: {} summarized, {} empty, {} posted, {} already handled, {} failed, {} purged",
        window.start(),
        window.end(),
        summarized,
        empty,
        posted,
        alreadyHandled,
        failed,
        purged);
    return report;
  }
}
