package io.intellixity.tally.examples.engine;

import io.intellixity.tally.jdbc.JdbcEventAdapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Configured event data sources by id, each bound to its warehouse adapter. */
public final class Sources {
  private final Map<String, JdbcEventAdapter> adapters;

  public Sources(Map<String, JdbcEventAdapter> adapters) {
    this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
  }

  public Set<String> ids() { return adapters.keySet(); }

  public JdbcEventAdapter adapter(String sourceId) {
    JdbcEventAdapter a = adapters.get(sourceId);
    if (a == null) throw new IllegalArgumentException("Unknown sourceId: " + sourceId);
    return a;
  }
}
