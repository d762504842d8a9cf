package com.chatdigest.backend.extract;

import com.chatdigest.backend.conversation.domain.ActionItem;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.shared.time.SlackTimestamps;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Pattern-based action item detection for messages the model never saw. Each rule contributes at
 * most one candidate per message, taken from its first match. Different rules may still yield
 * overlapping tasks for the same sentence; consumers treat the list as suggestions rather than a
 * deduplicated backlog.
 */
@Component
public class TaskHeuristicExtractor {

  public static final double HEURISTIC_CONFIDENCE = 0.6d;
  static final int MIN_TITLE_LENGTH = 5;

  private static final String VERBS =
      "review|check|update|send|create|fix|write|prepare|schedule|finish|complete|submit|share"
          + "|follow up|test|deploy|merge|draft|confirm|reply|book|call|email|look into"
          + "|investigate|document|ping|approve|implement|change|add|remove|do";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

  enum Rule {
    TODO("\\bto-?do\\b\\s*:?\\s*(?<title>[^\\n]+)"),
    PLEASE("\\bplease\\b[^\\n]{0,15}?\\b(?<title>(?:" + VERBS + ")\\b[^\\n.!?]*)"),
    NEED_TO("\\bneeds?\\s+to\\s+(?<title>(?:" + VERBS + ")\\b[^\\n.!?]*)"),
    DEADLINE(
        "\\b(?<title>(?:" + VERBS + ")\\b[^\\n.!?]*?\\b(?:by|before|after|on)\\b[^\\n.!?]*)"),
    CHECKLIST("\\[\\s?\\]\\s*(?<title>[^\\n]+)"),
    BULLET("^\\s*[*\\-\\u2022]\\s+(?<title>[^\\n]+)"),
    NUMBERED("^\\s*\\d+[.)]\\s+(?<title>[^\\n]+)");

    private final Pattern pattern;

    Rule(String regex) {
      this.pattern = Pattern.compile(regex, FLAGS);
    }
  }

  private final ZoneId zone;

  public TaskHeuristicExtractor(DigestProperties properties) {
    this.zone = properties.getSchedule().zoneId();
  }

  public List<ActionItem> extract(String text, String ts, String permalink) {
    return extract(text, ts, permalink, Set.of());
  }

  /**
   * @param excludedOwnerIds ids never inferred as owner (bots); they also do not count towards
   *     the single-mention rule
   */
  public List<ActionItem> extract(
      String text, String ts, String permalink, Set<String> excludedOwnerIds) {
    if (!StringUtils.hasText(text)) {
      return List.of();
    }
    String owner = inferOwner(text, excludedOwnerIds);
    LocalDate dueDate =
        ts == null ? null : DueDateParser.parse(text, SlackTimestamps.toInstant(ts), zone).orElse(null);

    List<ActionItem> items = new ArrayList<>();
    for (Rule rule : Rule.values()) {
      Matcher matcher = rule.pattern.matcher(text);
      if (matcher.find()) {
        normalizeTitle(matcher.group("title"))
            .ifPresent(
                title ->
                    items.add(
                        new ActionItem(
                            title, owner, dueDate, HEURISTIC_CONFIDENCE, ts, permalink)));
      }
    }
    return items;
  }

  static Optional<String> normalizeTitle(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String title = raw.replaceAll("\\s+", " ").trim().replaceAll("[\\s.,;:!]+$", "");
    return title.length() < MIN_TITLE_LENGTH ? Optional.empty() : Optional.of(title);
  }

  private static String inferOwner(String text, Set<String> excludedOwnerIds) {
    Set<String> candidates = new LinkedHashSet<>(MentionExtractor.extractMentions(text));
    if (excludedOwnerIds != null) {
      candidates.removeAll(excludedOwnerIds);
    }
    return candidates.size() == 1 ? candidates.iterator().next() : null;
  }
}
