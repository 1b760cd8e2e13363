package io.intellixity.tally.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovery output for one table: every known field node by dotted path (roots, struct children
 * and synthesized map keys) and the event definitions by event name.
 */
public record DiscoveredTable(EventDataTable table, Map<String, Field> fields, Map<String, EventDef> events) {
  public DiscoveredTable {
    Objects.requireNonNull(table, "table");
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    events = events == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(events));
  }

  public Optional<Field> field(String path) { return Optional.ofNullable(fields.get(path)); }

  public Optional<EventDef> event(String eventName) { return Optional.ofNullable(events.get(eventName)); }
}
