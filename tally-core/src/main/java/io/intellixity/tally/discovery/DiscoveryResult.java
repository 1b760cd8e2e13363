package io.intellixity.tally.discovery;

import io.intellixity.tally.error.DiscoveryPartialFailureException;
import io.intellixity.tally.model.DiscoveredEventDataSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Snapshot of every table that succeeded, plus the failure of each table that did not, by table id. */
public record DiscoveryResult(DiscoveredEventDataSource snapshot, Map<String, Throwable> failures) {
  public DiscoveryResult {
    Objects.requireNonNull(snapshot, "snapshot");
    failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  public boolean hasFailures() { return !failures.isEmpty(); }

  public DiscoveredEventDataSource orThrow() {
    if (hasFailures()) {
      throw new DiscoveryPartialFailureException("Discovery failed for tables " + failures.keySet()
          + " of source " + snapshot.sourceId(), this);
    }
    return snapshot;
  }
}
