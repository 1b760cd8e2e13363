package io.intellixity.tally.schema;

import io.intellixity.tally.error.SchemaException;
import io.intellixity.tally.model.DiscoveredEventDataSource;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the latest published schema snapshot per source id.\n
 *
 * Publishing replaces the previous snapshot wholesale and stamps it with a new version, so
 * readers holding an older snapshot keep a consistent view while new readers see the new one.\n
 */
public final class SchemaRegistry {
  private final Map<String, DiscoveredEventDataSource> snapshots = new ConcurrentHashMap<>();
  private final AtomicLong versions = new AtomicLong();

  public DiscoveredEventDataSource publish(DiscoveredEventDataSource snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    DiscoveredEventDataSource stamped = snapshot.withVersion(versions.incrementAndGet());
    snapshots.put(stamped.sourceId(), stamped);
    return stamped;
  }

  public Optional<DiscoveredEventDataSource> current(String sourceId) {
    return Optional.ofNullable(snapshots.get(sourceId));
  }

  public DiscoveredEventDataSource require(String sourceId) {
    DiscoveredEventDataSource s = snapshots.get(sourceId);
    if (s == null) throw new SchemaException("No discovered schema published for source " + sourceId);
    return s;
  }

  public void evict(String sourceId) { snapshots.remove(sourceId); }
}
