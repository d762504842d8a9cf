package com.chatdigest.backend.shared.time;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import org.springframework.util.StringUtils;

/**
 * Helpers for Slack message timestamps. A timestamp is a decimal string of epoch seconds with a
 * six digit microsecond fraction (for example {@code 1621573200.000100}) that doubles as the
 * message identifier inside a conversation, so ordering must be numeric rather than lexical.
 */
public final class SlackTimestamps {

  public static final Comparator<String> ORDER = SlackTimestamps::compare;

  private SlackTimestamps() {}

  public static BigDecimal parse(String ts) {
    if (!StringUtils.hasText(ts)) {
      throw new IllegalArgumentException("Slack timestamp must not be blank");
    }
    try {
      return new BigDecimal(ts.trim());
    } catch (NumberFormatException exception) {
      throw new IllegalArgumentException("Malformed Slack timestamp: " + ts, exception);
    }
  }

  public static int compare(String left, String right) {
    return parse(left).compareTo(parse(right));
  }

  public static boolean isAfter(String candidate, String reference) {
    return compare(candidate, reference) > 0;
  }

  /** Returns the greater of two timestamps, treating {@code null} as "no value". */
  public static String max(String left, String right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return compare(left, right) >= 0 ? left : right;
  }

  public static Instant toInstant(String ts) {
    BigDecimal value = parse(ts);
    long seconds = value.longValue();
    long micros =
        value
            .subtract(BigDecimal.valueOf(seconds))
            .movePointRight(6)
            .setScale(0, RoundingMode.DOWN)
            .longValue();
    return Instant.ofEpochSecond(seconds, micros * 1_000L);
  }

  public static String fromInstant(Instant instant) {
    return String.format("%d.%06d", instant.getEpochSecond(), instant.getNano() / 1_000);
  }
}
