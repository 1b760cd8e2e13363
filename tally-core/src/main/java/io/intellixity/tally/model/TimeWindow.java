package io.intellixity.tally.model;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

/** A duration expressed in calendar units, e.g. {@code 1 day} or {@code 2 week}. */
public record TimeWindow(int value, TimeGroup period) {
  public static final TimeWindow ONE_DAY = new TimeWindow(1, TimeGroup.DAY);
  public static final TimeWindow THIRTY_DAYS = new TimeWindow(30, TimeGroup.DAY);

  public TimeWindow {
    Objects.requireNonNull(period, "period");
    if (period == TimeGroup.TOTAL) throw new IllegalArgumentException("TOTAL cannot be used as a window period");
    if (value < 0) throw new IllegalArgumentException("window value must be >= 0: " + value);
  }

  /** Parses {@code "<int> <unit>"}; the unit is case-insensitive and may be plural. */
  public static TimeWindow parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("time window is blank");
    String[] parts = s.trim().split("\\s+");
    if (parts.length != 2) throw new IllegalArgumentException("time window must look like '1 day': " + s);
    return new TimeWindow(Integer.parseInt(parts[0]), TimeGroup.parse(parts[1]));
  }

  public LocalDateTime addTo(LocalDateTime t) { return period.add(t, value); }

  public LocalDateTime subtractFrom(LocalDateTime t) { return period.add(t, -value); }

  @Override
  public String toString() { return value + " " + period.name().toLowerCase(Locale.ROOT); }
}
