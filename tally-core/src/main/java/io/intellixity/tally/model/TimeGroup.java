package io.intellixity.tally.model;

import java.time.LocalDateTime;
import java.util.Locale;

/** Bucketing granularity of a time series; TOTAL collapses the series into one bucket. */
public enum TimeGroup {
  TOTAL,
  SECOND,
  MINUTE,
  HOUR,
  DAY,
  WEEK,
  MONTH,
  QUARTER,
  YEAR;

  /** Case-insensitive lookup; unknown names are rejected. */
  public static TimeGroup parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("time group is blank");
    String k = s.trim().toUpperCase(Locale.ROOT);
    if (k.endsWith("S") && !k.equals("TOTAL")) k = k.substring(0, k.length() - 1);
    return TimeGroup.valueOf(k);
  }

  LocalDateTime add(LocalDateTime t, long n) {
    return switch (this) {
      case SECOND -> t.plusSeconds(n);
      case MINUTE -> t.plusMinutes(n);
      case HOUR -> t.plusHours(n);
      case DAY -> t.plusDays(n);
      case WEEK -> t.plusWeeks(n);
      case MONTH -> t.plusMonths(n);
      case QUARTER -> t.plusMonths(3 * n);
      case YEAR -> t.plusYears(n);
      case TOTAL -> throw new IllegalArgumentException("TOTAL is not a time unit");
    };
  }
}
