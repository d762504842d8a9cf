package com.chatdigest.backend.extract;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Small English due-date recogniser for chat messages. Relative expressions are anchored at the
 * message's own timestamp in the configured zone. When several expressions occur, the one that
 * appears first in the text wins.
 */
public final class DueDateParser {

  private static final String WEEKDAYS = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";
  private static final String MONTHS =
      "jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
          + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE;

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b", FLAGS),
              (matcher, today) ->
                  LocalDate.of(
                      Integer.parseInt(matcher.group(1)),
                      Integer.parseInt(matcher.group(2)),
                      Integer.parseInt(matcher.group(3)))),
          new Rule(
              Pattern.compile("\\b(?:today|tonight|eod|end of (?:the )?day)\\b", FLAGS),
              (matcher, today) -> today),
          new Rule(Pattern.compile("\\btomorrow\\b", FLAGS), (matcher, today) -> today.plusDays(1)),
          new Rule(
              Pattern.compile("\\bnext week\\b", FLAGS),
              (matcher, today) -> today.with(TemporalAdjusters.next(DayOfWeek.MONDAY))),
          new Rule(
              Pattern.compile("\\bend of (?:the )?week\\b", FLAGS),
              (matcher, today) -> today.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY))),
          new Rule(
              Pattern.compile("\\bend of (?:the )?month\\b", FLAGS),
              (matcher, today) -> today.with(TemporalAdjusters.lastDayOfMonth())),
          new Rule(
              Pattern.compile("\\bin (\\d{1,3}) (days?|weeks?)\\b", FLAGS),
              (matcher, today) -> {
                long amount = Long.parseLong(matcher.group(1));
                return matcher.group(2).toLowerCase(Locale.ROOT).startsWith("week")
                    ? today.plusWeeks(amount)
                    : today.plusDays(amount);
              }),
          new Rule(
              Pattern.compile("\\b(?:(this|next) )?(" + WEEKDAYS + ")\\b", FLAGS),
              (matcher, today) -> {
                DayOfWeek day = DayOfWeek.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
                if ("next".equalsIgnoreCase(matcher.group(1))) {
                  return today
                      .with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                      .with(TemporalAdjusters.nextOrSame(day));
                }
                return today.with(TemporalAdjusters.nextOrSame(day));
              }),
          new Rule(
              Pattern.compile(
                  "\\b(" + MONTHS + ")\\.? (\\d{1,2})(?:st|nd|rd|th)?(?:,? (\\d{4}))?\\b", FLAGS),
              (matcher, today) -> monthDay(matcher.group(1), matcher.group(2), matcher.group(3), today)),
          new Rule(
              Pattern.compile(
                  "\\b(\\d{1,2})(?:st|nd|rd|th)? (?:of )?(" + MONTHS + ")\\b(?:,? (\\d{4}))?", FLAGS),
              (matcher, today) -> monthDay(matcher.group(2), matcher.group(1), matcher.group(3), today)));

  private DueDateParser() {}

  public static Optional<LocalDate> parse(String text, Instant reference, ZoneId zone) {
    if (!StringUtils.hasText(text)) {
      return Optional.empty();
    }
    LocalDate today = LocalDate.ofInstant(reference, zone);
    int bestStart = Integer.MAX_VALUE;
    LocalDate best = null;
    for (Rule rule : RULES) {
      Matcher matcher = rule.pattern().matcher(text);
      while (matcher.find()) {
        if (matcher.start() >= bestStart) {
          break;
        }
        LocalDate resolved = resolve(rule, matcher, today);
        if (resolved != null) {
          bestStart = matcher.start();
          best = resolved;
          break;
        }
      }
    }
    return Optional.ofNullable(best);
  }

  private static LocalDate resolve(Rule rule, Matcher matcher, LocalDate today) {
    try {
      return rule.resolver().apply(matcher, today);
    } catch (DateTimeException | NumberFormatException invalid) {
      // 2024-02-31 and similar look like dates but are not
      return null;
    }
  }

  private static LocalDate monthDay(String monthToken, String dayToken, String yearToken, LocalDate today) {
    Month month = parseMonth(monthToken);
    int day = Integer.parseInt(dayToken);
    if (yearToken != null) {
      return LocalDate.of(Integer.parseInt(yearToken), month, day);
    }
    LocalDate candidate = LocalDate.of(today.getYear(), month, day);
    return candidate.isBefore(today) ? candidate.plusYears(1) : candidate;
  }

  private static Month parseMonth(String token) {
    String prefix = token.substring(0, 3).toUpperCase(Locale.ROOT);
    for (Month month : Month.values()) {
      if (month.name().startsWith(prefix)) {
        return month;
      }
    }
    throw new DateTimeException("Unknown month " + token);
  }

  private record Rule(Pattern pattern, BiFunction<Matcher, LocalDate, LocalDate> resolver) {}
}
