package io.intellixity.tally.segment;

import java.util.Objects;

/** Reference to a discovered field by event name and dotted path. */
public record EventFieldRef(String eventName, String fieldPath) {
  public EventFieldRef {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(fieldPath, "fieldPath");
  }
}
