package io.intellixity.tally.model;

import java.time.LocalDateTime;
import java.util.Objects;

/** Half-open interval {@code [start, end)} of naive warehouse-local datetimes. */
public record DateRange(LocalDateTime start, LocalDateTime end) {
  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) throw new IllegalArgumentException("start must be before end: " + start + " / " + end);
  }

  public static DateRange lookback(LocalDateTime end, TimeWindow window) {
    return new DateRange(window.subtractFrom(end), end);
  }
}
