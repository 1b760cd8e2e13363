package io.intellixity.tally.discovery;

import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.Field;

import java.util.List;
import java.util.Map;

/**
 * Warehouse capabilities the {@link DiscoveryEngine} needs.\n
 *
 * Enumeration results are keyed by event name, then by dotted field path. Non event-specific
 * calls key everything under {@link io.intellixity.tally.model.EventDef#ANY_EVENT}. A null value
 * list means the distinct count reached the limit; values are never truncated.\n
 */
public interface SchemaIntrospector {
  List<Field> listFields(EventDataTable table);

  /** Sorted distinct event names of the table within the scope's range. */
  List<String> listDistinctEventNames(EventDataTable table, DiscoveryScope scope);

  Map<String, Map<String, List<Object>>> sampleFieldEnumValues(EventDataTable table,
                                                               List<Field> fields,
                                                               boolean eventSpecific,
                                                               int cardinalityLimit,
                                                               DiscoveryScope scope);

  /** Keys of a MAP column by event name; null when the key count reached the limit. */
  Map<String, List<String>> discoverMapKeys(EventDataTable table,
                                            Field mapField,
                                            boolean eventSpecific,
                                            int cardinalityLimit,
                                            DiscoveryScope scope);
}
