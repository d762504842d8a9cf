package com.chatdigest.backend.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/** Time range summarized as one unit. Both bounds are inclusive. */
public record SummaryWindow(Instant start, Instant end) {

  public SummaryWindow {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must not be after end");
    }
  }

  /**
   * The window of length {@code size} that ends at the last full hour before {@code now} in {@code
   * zone}. Repeated calls within the same hour return the same window, which lets the scheduled
   * cycle recognise windows it already handled.
   */
  public static SummaryWindow lastClosed(Instant now, Duration size, ZoneId zone) {
    if (size.isNegative() || size.isZero()) {
      throw new IllegalArgumentException("size must be positive");
    }
    Instant end = now.atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant();
    return new SummaryWindow(end.minus(size), end);
  }

  /** Consecutive windows of {@code interval} covering [start, end]; the last one may be shorter. */
  public static List<SummaryWindow> split(Instant start, Instant end, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must not be after end");
    }
    List<SummaryWindow> windows = new ArrayList<>();
    Instant cursor = start;
    do {
      Instant next = cursor.plus(interval);
      Instant windowEnd = next.isAfter(end) ? end : next;
      windows.add(new SummaryWindow(cursor, windowEnd));
      cursor = next;
    } while (cursor.isBefore(end));
    return windows;
  }
}
