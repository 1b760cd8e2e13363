package io.intellixity.tally.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable schema snapshot of one {@link EventDataSource}.\n
 *
 * A snapshot is never mutated; re-discovery publishes a new one with a higher version.\n
 * Metric and segment trees only hold event names and field paths, resolved here on use.\n
 */
public final class DiscoveredEventDataSource {
  private final String sourceId;
  private final long version;
  private final Map<String, DiscoveredTable> tables;

  public DiscoveredEventDataSource(String sourceId, long version, List<DiscoveredTable> tables) {
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.version = version;
    Map<String, DiscoveredTable> m = new LinkedHashMap<>();
    for (DiscoveredTable t : Objects.requireNonNull(tables, "tables")) m.put(t.table().id(), t);
    this.tables = Collections.unmodifiableMap(m);
  }

  public String sourceId() { return sourceId; }
  public long version() { return version; }

  public List<DiscoveredTable> tables() { return List.copyOf(tables.values()); }

  public Optional<DiscoveredTable> table(String tableId) { return Optional.ofNullable(tables.get(tableId)); }

  public DiscoveredEventDataSource withVersion(long version) {
    return new DiscoveredEventDataSource(sourceId, version, List.copyOf(tables.values()));
  }

  /** Tables defining {@code eventName}, in declaration order; every table for {@link EventDef#ANY_EVENT}. */
  public List<DiscoveredTable> tablesFor(String eventName) {
    if (EventDef.ANY_EVENT.equals(eventName)) return tables();
    List<DiscoveredTable> out = new ArrayList<>();
    for (DiscoveredTable t : tables.values()) {
      if (t.events().containsKey(eventName)) out.add(t);
    }
    return out;
  }

  public Optional<EventDef> event(String eventName) {
    for (DiscoveredTable t : tables.values()) {
      EventDef d = t.events().get(eventName);
      if (d != null) return Optional.of(d);
    }
    return Optional.empty();
  }

  /** Resolves a field path for an event; the wildcard event matches a field of any table. */
  public Optional<Field> field(String eventName, String path) {
    if (EventDef.ANY_EVENT.equals(eventName)) {
      for (DiscoveredTable t : tables.values()) {
        Optional<Field> f = t.field(path);
        if (f.isPresent()) return f;
      }
      return Optional.empty();
    }
    return event(eventName).flatMap(d -> d.field(path)).map(EventFieldDef::field);
  }

  public List<String> eventNames() {
    List<String> out = new ArrayList<>();
    for (DiscoveredTable t : tables.values()) {
      for (String e : t.events().keySet()) if (!out.contains(e)) out.add(e);
    }
    return out;
  }
}
