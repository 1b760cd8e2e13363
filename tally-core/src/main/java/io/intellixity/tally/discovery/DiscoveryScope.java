package io.intellixity.tally.discovery;

import io.intellixity.tally.model.DateRange;
import io.intellixity.tally.util.CancellationToken;

import java.util.Objects;

/**
 * Bounds of one discovery run: the caller's time range (null scans every row), the per-event
 * row sample size and the cancellation signal every sub-query observes.
 */
public record DiscoveryScope(DateRange range, int sampleSize, CancellationToken cancellation) {
  public DiscoveryScope {
    if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
    Objects.requireNonNull(cancellation, "cancellation");
  }
}
