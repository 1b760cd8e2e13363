package io.intellixity.tally.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Discovered fields of one event name within one table, keyed by dotted field path. */
public record EventDef(String sourceId, String tableId, String eventName, Map<String, EventFieldDef> fields) {
  /** Wildcard event name matching every row of a table. */
  public static final String ANY_EVENT = "any_event";

  public EventDef {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(tableId, "tableId");
    Objects.requireNonNull(eventName, "eventName");
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Optional<EventFieldDef> field(String path) { return Optional.ofNullable(fields.get(path)); }
}
