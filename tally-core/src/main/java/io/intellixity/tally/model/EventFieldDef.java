package io.intellixity.tally.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A leaf field as observed for one event. {@code enums} is null when the field had too many
 * distinct values to enumerate. The owning source and table are referenced by id.
 */
public record EventFieldDef(String sourceId, String tableId, String eventName, Field field, List<Object> enums) {
  public EventFieldDef {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(tableId, "tableId");
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(field, "field");
    if (enums != null) enums = Collections.unmodifiableList(new ArrayList<>(enums));
  }

  public String path() { return field.path(); }

  public boolean hasEnums() { return enums != null; }
}
