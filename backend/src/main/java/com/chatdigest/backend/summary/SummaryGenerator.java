package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.store.ConversationStore;
import com.chatdigest.backend.directory.UserDirectoryService;
import com.chatdigest.backend.extract.MentionExtractor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Produces and stores the summary of one conversation window. The model path is attempted when a
 * {@link ModelSummarizer} is available; any failure there falls back to {@link
 * HeuristicSummaryBuilder}, so a non-empty window always yields a stored summary.
 */
@Service
public class SummaryGenerator {

  private static final Logger log = LoggerFactory.getLogger(SummaryGenerator.class);

  private static final String RUNS_METRIC = "digest_summary_runs_total";
  private static final String FALLBACK_METRIC = "digest_summary_fallbacks_total";

  private final ConversationStore store;
  private final UserDirectoryService directory;
  private final HeuristicSummaryBuilder heuristicBuilder;
  private final ModelSummarizer modelSummarizer;
  private final Counter modelCounter;
  private final Counter heuristicCounter;
  private final Counter fallbackCounter;

  public SummaryGenerator(
      ConversationStore store,
      UserDirectoryService directory,
      HeuristicSummaryBuilder heuristicBuilder,
      ObjectProvider<ModelSummarizer> modelSummarizer,
      MeterRegistry meterRegistry) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.directory = Objects.requireNonNull(directory, "directory must not be null");
    this.heuristicBuilder = Objects.requireNonNull(heuristicBuilder, "heuristicBuilder must not be null");
    this.modelSummarizer = modelSummarizer.getIfAvailable();
    this.modelCounter = meterRegistry.counter(RUNS_METRIC, "origin", "model");
    this.heuristicCounter = meterRegistry.counter(RUNS_METRIC, "origin", "heuristic");
    this.fallbackCounter = meterRegistry.counter(FALLBACK_METRIC);
  }

  public boolean isModelConfigured() {
    return modelSummarizer != null;
  }

  public SummaryOutcome generate(UUID conversationId, Instant start, Instant end) {
    Objects.requireNonNull(start, "start must not be null");
    Objects.requireNonNull(end, "end must not be null");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("Window start " + start + " is after end " + end);
    }
    SummaryState state = SummaryState.IDLE;
    Conversation conversation =
        store
            .findConversation(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));

    state = transition(conversation, state, SummaryState.FETCHING);
    List<ConversationMessage> messages = store.findMessagesInWindow(conversation, start, end);
    if (messages.isEmpty()) {
      transition(conversation, state, SummaryState.EMPTY);
      log.info(
          "No messages in #{} between {} and {}, nothing to summarize",
          conversation.getName(),
          start,
          end);
      return SummaryOutcome.empty(conversation);
    }

    state = transition(conversation, state, SummaryState.GENERATING);
    Set<String> botIds = directory.botIds(participantIds(messages));
    SummaryDraft draft =
        tryModel(conversation, messages, start, end)
            .orElseGet(() -> heuristic(messages, botIds));

    DigestSummary summary =
        store.createSummary(
            conversation, start, end, draft.recap(), draft.content(), draft.origin());
    transition(conversation, state, SummaryState.PERSISTED);
    log.info(
        "Stored {} summary {} for #{} ({} messages, {} highlights, {} tasks)",
        draft.origin(),
        summary.getId(),
        conversation.getName(),
        messages.size(),
        draft.content().highlights().size(),
        draft.content().tasks().size());
    return SummaryOutcome.persisted(conversation, summary);
  }

  private Optional<SummaryDraft> tryModel(
      Conversation conversation, List<ConversationMessage> messages, Instant start, Instant end) {
    if (modelSummarizer == null) {
      return Optional.empty();
    }
    try {
      SummaryDraft draft = modelSummarizer.summarize(conversation, messages, start, end);
      modelCounter.increment();
      return Optional.of(draft);
    } catch (RuntimeException exception) {
      fallbackCounter.increment();
      log.warn(
          "Model summary failed for #{}, falling back to heuristics: {}",
          conversation.getName(),
          exception.getMessage());
      return Optional.empty();
    }
  }

  private SummaryDraft heuristic(List<ConversationMessage> messages, Set<String> botIds) {
    heuristicCounter.increment();
    return heuristicBuilder.build(messages, botIds);
  }

  private static Set<String> participantIds(List<ConversationMessage> messages) {
    Set<String> ids = new LinkedHashSet<>();
    for (ConversationMessage message : messages) {
      if (StringUtils.hasText(message.getAuthorId())) {
        ids.add(message.getAuthorId());
      }
      ids.addAll(MentionExtractor.extractMentions(message.getText()));
    }
    return ids;
  }

  private static SummaryState transition(
      Conversation conversation, SummaryState from, SummaryState to) {
    log.debug("Summary of #{}: {} -> {}", conversation.getName(), from, to);
    return to;
  }
}
