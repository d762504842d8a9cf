package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.ActionItem;
import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.Highlight;
import com.chatdigest.backend.conversation.domain.MentionStat;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.shared.time.Sleeper;
import com.chatdigest.backend.summary.model.ModelSummaryResponse;
import com.chatdigest.backend.summary.model.ModelSummaryResponse.ModelHighlight;
import com.chatdigest.backend.summary.model.ModelSummaryResponse.ModelMention;
import com.chatdigest.backend.summary.model.ModelSummaryResponse.ModelTask;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;

/**
 * Model-backed summarizer. Sends the window transcript through Spring AI's {@link ChatClient} and
 * maps the structured reply onto {@link DigestContent}. Items that point at messages outside the
 * window are dropped.
 */
@Slf4j
public class SpringAiModelSummarizer implements ModelSummarizer {

  static final double DEFAULT_MODEL_CONFIDENCE = 0.8d;

  private static final long MAX_BACKOFF_MS = 2000L;

  private static final Pattern USER_REFERENCE = Pattern.compile("<@([A-Z0-9]+)(?:\\|[^>]*)?>");

  private static final String SYSTEM_PROMPT =
      """
      You summarise workplace chat conversations for a daily digest.
      Be factual and concise. Never invent messages, people or dates.
      Refer to people only by their user id in the form <@ID>.
      Use the exact ts values from the transcript when you reference messages.
      """;

  private final ChatClient chatClient;
  private final BeanOutputConverter<ModelSummaryResponse> outputConverter;
  private final RetryTemplate retryTemplate;

  public SpringAiModelSummarizer(
      ChatClient chatClient,
      BeanOutputConverter<ModelSummaryResponse> outputConverter,
      DigestProperties properties,
      Sleeper sleeper) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
    this.outputConverter = Objects.requireNonNull(outputConverter, "outputConverter must not be null");
    this.retryTemplate =
        buildRetryTemplate(
            properties.getModel(), Objects.requireNonNull(sleeper, "sleeper must not be null"));
  }

  @Override
  public SummaryDraft summarize(
      Conversation conversation, List<ConversationMessage> messages, Instant start, Instant end) {
    String prompt = buildPrompt(conversation, messages, start, end);
    String content = invoke(prompt);
    ModelSummaryResponse response = parse(content);
    if (response == null || !StringUtils.hasText(response.summary())) {
      throw new ModelSummarizationException("Model returned no summary text");
    }
    Map<String, ConversationMessage> byTs =
        messages.stream()
            .collect(
                Collectors.toMap(
                    ConversationMessage::getTs, Function.identity(), (first, second) -> first));
    DigestContent digestContent =
        new DigestContent(
            toHighlights(response.highlights(), byTs),
            toTasks(response.tasks(), byTs),
            toMentions(response.mentions()));
    return new SummaryDraft(response.summary().strip(), digestContent, SummaryOrigin.MODEL);
  }

  private String buildPrompt(
      Conversation conversation, List<ConversationMessage> messages, Instant start, Instant end) {
    return """
        Conversation: #%s
        Window: %s to %s

        Produce a JSON object with:
        - "summary": a short recap of the discussion,
        - "highlights": the most important messages (ts, text, reason),
        - "tasks": action items (title, owner as user id or null, dueDate as yyyy-MM-dd or null, confidence 0..1, ts),
        - "mentions": users referenced in the window (userId, count, contexts).

        %s

        Transcript:
        %s
        """
        .formatted(
            conversation.getName(),
            start,
            end,
            outputConverter.getFormat(),
            TranscriptBuilder.build(messages));
  }

  private String invoke(String prompt) {
    try {
      return retryTemplate.execute(
          context -> requestContent(prompt),
          context -> {
            throw exhausted(context);
          });
    } catch (BackOffInterruptedException interrupted) {
      throw new ModelSummarizationException("Model summary interrupted", interrupted);
    }
  }

  private String requestContent(String prompt) {
    String content = chatClient.prompt().system(SYSTEM_PROMPT).user(prompt).call().content();
    if (!StringUtils.hasText(content)) {
      throw new ModelSummarizationException("Model returned an empty response");
    }
    return content;
  }

  private static ModelSummarizationException exhausted(RetryContext context) {
    Throwable last = context.getLastThrowable();
    if (last instanceof ModelSummarizationException modelException) {
      return modelException;
    }
    return new ModelSummarizationException(
        "Model request failed after " + context.getRetryCount() + " attempts", last);
  }

  static RetryTemplate buildRetryTemplate(DigestProperties.Model model, Sleeper sleeper) {
    int attempts = Math.max(1, model.getMaxAttempts());
    long initialInterval =
        model.getRetryDelay() != null ? Math.max(1L, model.getRetryDelay().toMillis()) : 250L;

    ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
    backOffPolicy.setInitialInterval(Math.min(initialInterval, MAX_BACKOFF_MS));
    backOffPolicy.setMultiplier(2.0d);
    backOffPolicy.setMaxInterval(MAX_BACKOFF_MS);
    backOffPolicy.setSleeper(millis -> sleeper.sleep(Duration.ofMillis(millis)));

    return RetryTemplate.builder()
        .maxAttempts(attempts)
        .customBackoff(backOffPolicy)
        .retryOn(RuntimeException.class)
        .build();
  }

  private ModelSummaryResponse parse(String content) {
    try {
      return outputConverter.convert(content);
    } catch (RuntimeException exception) {
      throw new ModelSummarizationException("Model returned malformed JSON", exception);
    }
  }

  private static List<Highlight> toHighlights(
      List<ModelHighlight> highlights, Map<String, ConversationMessage> byTs) {
    if (highlights == null) {
      return List.of();
    }
    List<Highlight> result = new ArrayList<>();
    for (ModelHighlight highlight : highlights) {
      if (highlight == null || highlight.ts() == null) {
        continue;
      }
      ConversationMessage source = byTs.get(highlight.ts());
      if (source == null) {
        log.debug("Dropping model highlight outside the window: {}", highlight.ts());
        continue;
      }
      String text = StringUtils.hasText(highlight.text()) ? highlight.text() : source.getText();
      result.add(
          new Highlight(
              source.getTs(), source.getAuthorId(), text, source.getPermalink(), highlight.reason()));
    }
    return result;
  }

  private static List<ActionItem> toTasks(
      List<ModelTask> tasks, Map<String, ConversationMessage> byTs) {
    if (tasks == null) {
      return List.of();
    }
    List<ActionItem> result = new ArrayList<>();
    for (ModelTask task : tasks) {
      if (task == null || !StringUtils.hasText(task.title())) {
        continue;
      }
      ConversationMessage source = task.ts() == null ? null : byTs.get(task.ts());
      if (task.ts() != null && source == null) {
        log.debug("Dropping model task outside the window: {}", task.ts());
        continue;
      }
      double confidence = task.confidence() == null ? DEFAULT_MODEL_CONFIDENCE : task.confidence();
      result.add(
          new ActionItem(
              task.title().strip(),
              normalizeUserId(task.owner()),
              parseDate(task.dueDate()),
              confidence,
              task.ts(),
              source != null ? source.getPermalink() : null));
    }
    return result;
  }

  private static List<MentionStat> toMentions(List<ModelMention> mentions) {
    if (mentions == null) {
      return List.of();
    }
    List<MentionStat> result = new ArrayList<>();
    for (ModelMention mention : mentions) {
      String userId = mention == null ? null : normalizeUserId(mention.userId());
      if (userId == null) {
        continue;
      }
      List<String> contexts = mention.contexts() == null ? List.of() : mention.contexts();
      int count = mention.count() != null ? mention.count() : Math.max(1, contexts.size());
      result.add(new MentionStat(userId, count, contexts));
    }
    return result;
  }

  static String normalizeUserId(String value) {
    if (!StringUtils.hasText(value) || "null".equalsIgnoreCase(value.trim())) {
      return null;
    }
    Matcher matcher = USER_REFERENCE.matcher(value);
    return matcher.find() ? matcher.group(1) : value.trim();
  }

  private static LocalDate parseDate(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException exception) {
      return null;
    }
  }
}
