package com.chatdigest.backend.extract;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Finds user references in Slack message markup. Both {@code <@U123>} and the labelled form
 * {@code <@U123|alice>} are recognised. The result is deduplicated; iteration follows first
 * appearance.
 */
public final class MentionExtractor {

  private static final Pattern MENTION = Pattern.compile("<@([A-Z0-9]+)(?:\\|[^>]*)?>");

  private MentionExtractor() {}

  public static Set<String> extractMentions(String text) {
    if (!StringUtils.hasText(text)) {
      return Set.of();
    }
    Set<String> mentions = new LinkedHashSet<>();
    Matcher matcher = MENTION.matcher(text);
    while (matcher.find()) {
      mentions.add(matcher.group(1));
    }
    return Collections.unmodifiableSet(mentions);
  }
}
