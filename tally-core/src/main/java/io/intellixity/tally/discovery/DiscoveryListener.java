package io.intellixity.tally.discovery;

import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.EventDef;

/** Progress callbacks of a discovery run, invoked on the discovering thread. */
public interface DiscoveryListener {
  DiscoveryListener NONE = new DiscoveryListener() {};

  default void onTableStarted(EventDataTable table) {}

  default void onEventDiscovered(EventDataTable table, EventDef event) {}

  default void onTableCompleted(EventDataTable table, int eventCount) {}

  default void onTableFailed(EventDataTable table, Throwable error) {}
}
