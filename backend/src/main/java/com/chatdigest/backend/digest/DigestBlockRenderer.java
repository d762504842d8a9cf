package com.chatdigest.backend.digest;

import com.chatdigest.backend.conversation.domain.ActionItem;
import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.domain.Highlight;
import com.chatdigest.backend.conversation.domain.MentionStat;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.slack.api.model.block.ContextBlock;
import com.slack.api.model.block.DividerBlock;
import com.slack.api.model.block.HeaderBlock;
import com.slack.api.model.block.LayoutBlock;
import com.slack.api.model.block.SectionBlock;
import com.slack.api.model.block.composition.MarkdownTextObject;
import com.slack.api.model.block.composition.PlainTextObject;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns a stored summary into Block Kit. Sections are omitted when they would be empty; the
 * recap is always present.
 */
@Component
public class DigestBlockRenderer {

  /** Slack rejects section text above this length with {@code invalid_blocks}. */
  static final int SECTION_LIMIT = 3000;

  private static final int HEADER_LIMIT = 150;
  private static final int FALLBACK_LIMIT = 200;
  private static final String ELLIPSIS = "...";

  private final DigestProperties.Posting posting;
  private final DateTimeFormatter fallbackFormat;

  public DigestBlockRenderer(DigestProperties properties) {
    this.posting = properties.getPosting();
    ZoneId zone = properties.getSchedule().zoneId();
    this.fallbackFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z").withZone(zone);
  }

  public RenderedDigest render(Conversation conversation, DigestSummary summary) {
    DigestContent content = summary.getContent();
    List<LayoutBlock> blocks = new ArrayList<>();
    String title = "Digest: #" + conversation.getName();
    blocks.add(
        HeaderBlock.builder()
            .text(PlainTextObject.builder().text(truncate(title, HEADER_LIMIT)).emoji(true).build())
            .build());
    blocks.add(
        ContextBlock.builder()
            .elements(
                List.of(
                    markdown(
                        "*Period:* "
                            + slackDate(summary.getWindowStart())
                            + " to "
                            + slackDate(summary.getWindowEnd()))))
            .build());
    blocks.add(DividerBlock.builder().build());
    blocks.add(
        section(truncate(summary.getRecap(), Math.min(posting.getRecapLimit(), SECTION_LIMIT))));

    if (!content.highlights().isEmpty()) {
      blocks.addAll(
          listSections(
              "*Key Messages*", content.highlights().stream().map(this::highlightLine).toList()));
    }
    if (!content.tasks().isEmpty()) {
      blocks.addAll(
          listSections("*Action Items*", content.tasks().stream().map(this::taskLine).toList()));
    }
    List<MentionStat> ranked = rankMentions(content.mentions(), posting.getMentionRankLimit());
    if (!ranked.isEmpty()) {
      blocks.addAll(
          listSections(
              "*Mention Stats*",
              ranked.stream()
                  .map(
                      stat ->
                          "<@"
                              + stat.userId()
                              + ">: "
                              + stat.count()
                              + (stat.count() == 1 ? " mention" : " mentions"))
                  .toList()));
    }
    blocks.add(
        ContextBlock.builder()
            .elements(
                List.of(
                    markdown(
                        summary.getOrigin() == SummaryOrigin.MODEL
                            ? "_Summarized by the language model_"
                            : "_Summarized heuristically_")))
            .build());

    String fallback = title + ": " + firstLine(summary.getRecap());
    return new RenderedDigest(truncate(fallback, FALLBACK_LIMIT), blocks);
  }

  /** Highest counts first; equal counts keep discovery order. */
  static List<MentionStat> rankMentions(List<MentionStat> mentions, int limit) {
    return mentions.stream()
        .sorted(Comparator.comparingInt(MentionStat::count).reversed())
        .limit(limit)
        .toList();
  }

  private String highlightLine(Highlight highlight) {
    String text = truncate(collapse(highlight.text()), posting.getHighlightTextLimit());
    String line =
        StringUtils.hasText(highlight.permalink())
            ? "<" + highlight.permalink() + "|" + linkLabel(text) + ">"
            : text;
    return StringUtils.hasText(highlight.authorId())
        ? line + " (<@" + highlight.authorId() + ">)"
        : line;
  }

  private String taskLine(ActionItem task) {
    StringBuilder line =
        new StringBuilder(truncate(collapse(task.title()), posting.getTaskTitleLimit()));
    if (task.ownerId() != null) {
      line.append(" (Owner: <@").append(task.ownerId()).append(">)");
    }
    if (task.dueDate() != null) {
      line.append(" (Due: ").append(task.dueDate()).append(')');
    }
    return line.toString();
  }

  private String slackDate(Instant instant) {
    return "<!date^"
        + instant.getEpochSecond()
        + "^{date_short} {time}|"
        + fallbackFormat.format(instant)
        + ">";
  }

  /**
   * Bulleted lines under a heading. Lines that would push a section past {@link #SECTION_LIMIT}
   * continue in a further section without the heading.
   */
  static List<SectionBlock> listSections(String heading, List<String> lines) {
    List<SectionBlock> sections = new ArrayList<>();
    StringBuilder text = new StringBuilder(heading);
    for (String line : lines) {
      String entry = "• " + truncate(line, SECTION_LIMIT - heading.length() - 3);
      if (text.length() + 1 + entry.length() > SECTION_LIMIT) {
        sections.add(section(text.toString()));
        text = new StringBuilder(entry);
      } else {
        text.append('\n').append(entry);
      }
    }
    sections.add(section(text.toString()));
    return sections;
  }

  private static SectionBlock section(String text) {
    return SectionBlock.builder().text(markdown(text)).build();
  }

  private static MarkdownTextObject markdown(String text) {
    return MarkdownTextObject.builder().text(text).build();
  }

  private static String linkLabel(String text) {
    return text.replace("|", "/").replace("<", "&lt;").replace(">", "&gt;");
  }

  private static String firstLine(String text) {
    if (text == null) {
      return "";
    }
    int newline = text.indexOf('\n');
    return newline < 0 ? text : text.substring(0, newline);
  }

  private static String collapse(String text) {
    return text == null ? "" : text.replaceAll("\\s+", " ").trim();
  }

  static String truncate(String text, int limit) {
    if (text == null) {
      return "";
    }
    if (text.length() <= limit) {
      return text;
    }
    return text.substring(0, Math.max(0, limit - ELLIPSIS.length())) + ELLIPSIS;
  }
}
