package io.intellixity.tally.discovery;

import io.intellixity.tally.error.QueryCancelledException;
import io.intellixity.tally.error.SchemaException;
import io.intellixity.tally.model.*;
import io.intellixity.tally.schema.SchemaRegistry;
import io.intellixity.tally.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds a {@link DiscoveredEventDataSource} from live warehouse tables.\n
 *
 * Per table: list columns minus ignored ones, split them into generic and event-specific
 * (by name prefix), discover MAP keys as dotted sub-fields, enumerate generic values once
 * over the whole table and event-specific values per event name.\n
 * A failing table is recorded and skipped; the others are still published. Cancellation
 * aborts the whole run.\n
 */
public final class DiscoveryEngine {
  private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

  private final SchemaIntrospector introspector;
  private final SchemaRegistry registry;

  public DiscoveryEngine(SchemaIntrospector introspector, SchemaRegistry registry) {
    this.introspector = Objects.requireNonNull(introspector, "introspector");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public DiscoveryResult discover(EventDataSource source) {
    return discover(source, source.tables(), source.defaultDiscoveryRange(), DiscoveryListener.NONE,
        CancellationToken.create());
  }

  public DiscoveryResult discover(EventDataSource source,
                                  Collection<EventDataTable> tables,
                                  DateRange range,
                                  DiscoveryListener listener,
                                  CancellationToken cancellation) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(tables, "tables");
    DiscoveryListener l = listener == null ? DiscoveryListener.NONE : listener;
    DateRange effective = range != null ? range : source.defaultDiscoveryRange();
    DiscoveryScope scope = new DiscoveryScope(effective, source.propertySampleSize(),
        cancellation == null ? CancellationToken.create() : cancellation);

    List<DiscoveredTable> done = new ArrayList<>();
    Map<String, Throwable> failures = new LinkedHashMap<>();
    for (EventDataTable table : tables) {
      scope.cancellation().throwIfCancelled("Discovery of source " + source.id());
      l.onTableStarted(table);
      long start = System.nanoTime();
      try {
        DiscoveredTable dt = discoverTable(source, table, scope, l);
        done.add(dt);
        l.onTableCompleted(table, dt.events().size());
        log.info("tally.discovery op=TABLE source={} table={} events={} fields={} tookMs={}",
            source.id(), table.id(), dt.events().size(), dt.fields().size(), (System.nanoTime() - start) / 1_000_000);
      } catch (QueryCancelledException e) {
        throw e;
      } catch (RuntimeException e) {
        failures.put(table.id(), e);
        l.onTableFailed(table, e);
        log.warn("tally.discovery op=TABLE_FAILED source={} table={} error={}", source.id(), table.id(), e.toString());
      }
    }

    DiscoveredEventDataSource snapshot = new DiscoveredEventDataSource(source.id(), 0, done);
    if (!done.isEmpty()) snapshot = registry.publish(snapshot);
    return new DiscoveryResult(snapshot, failures);
  }

  private DiscoveredTable discoverTable(EventDataSource source, EventDataTable table, DiscoveryScope scope,
                                        DiscoveryListener listener) {
    String op = "Discovery of table " + table.id();
    List<Field> roots = new ArrayList<>();
    for (Field f : introspector.listFields(table)) {
      if (table.isIgnored(f.name())) continue;
      roots.add(withoutIgnored(table, f));
    }
    requireColumns(table, roots);

    int enumLimit = source.enumLimitFor(table);
    int mapLimit = source.mapKeyLimitFor(table);

    Map<String, Field> registryFields = new LinkedHashMap<>();
    List<Field> genericLeaves = new ArrayList<>();
    List<Field> specificLeaves = new ArrayList<>();
    Map<String, List<Field>> mapLeavesByEvent = new LinkedHashMap<>();

    for (Field root : roots) {
      if (table.isSystemField(root.name())) {
        register(registryFields, root);
        continue;
      }
      boolean specific = table.isEventSpecific(root.name());
      if (root.type() != DataType.MAP) {
        register(registryFields, root);
        (specific ? specificLeaves : genericLeaves).addAll(root.leaves());
        continue;
      }

      scope.cancellation().throwIfCancelled(op);
      Map<String, List<String>> keys = introspector.discoverMapKeys(table, root, specific, mapLimit, scope);
      if (!specific) {
        Field mf = withKeys(root, keys.get(EventDef.ANY_EVENT));
        register(registryFields, mf);
        genericLeaves.addAll(mf.leaves());
        continue;
      }
      LinkedHashSet<String> union = new LinkedHashSet<>();
      for (Map.Entry<String, List<String>> e : keys.entrySet()) {
        Field mf = withKeys(root, e.getValue());
        mapLeavesByEvent.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(mf.leaves());
        if (e.getValue() != null) union.addAll(e.getValue());
      }
      register(registryFields, withKeys(root, new ArrayList<>(union)));
    }

    scope.cancellation().throwIfCancelled(op);
    Map<String, List<Object>> genericEnums = genericLeaves.isEmpty()
        ? Map.of()
        : introspector.sampleFieldEnumValues(table, genericLeaves, false, enumLimit, scope)
            .getOrDefault(EventDef.ANY_EVENT, Map.of());

    scope.cancellation().throwIfCancelled(op);
    List<String> eventNames = new ArrayList<>(introspector.listDistinctEventNames(table, scope));
    Collections.sort(eventNames);

    Map<String, Field> allSpecific = new LinkedHashMap<>();
    for (Field f : specificLeaves) allSpecific.put(f.path(), f);
    for (List<Field> fs : mapLeavesByEvent.values()) for (Field f : fs) allSpecific.putIfAbsent(f.path(), f);

    Map<String, Map<String, List<Object>>> specificEnums = Map.of();
    if (!allSpecific.isEmpty()) {
      scope.cancellation().throwIfCancelled(op);
      specificEnums = introspector.sampleFieldEnumValues(table, new ArrayList<>(allSpecific.values()), true, enumLimit, scope);
    }

    Map<String, EventDef> events = new LinkedHashMap<>();
    for (String eventName : eventNames) {
      Map<String, EventFieldDef> defs = new LinkedHashMap<>();
      addFields(defs, source, table, eventName, genericLeaves, genericEnums);
      List<Field> leaves = new ArrayList<>(specificLeaves);
      leaves.addAll(mapLeavesByEvent.getOrDefault(eventName, List.of()));
      addFields(defs, source, table, eventName, leaves, specificEnums.getOrDefault(eventName, Map.of()));
      EventDef def = new EventDef(source.id(), table.id(), eventName, defs);
      events.put(eventName, def);
      listener.onEventDiscovered(table, def);
    }
    return new DiscoveredTable(table, registryFields, events);
  }

  /** A field observed only as NULL for the event is left out; a null enum list means "too many". */
  private static void addFields(Map<String, EventFieldDef> out, EventDataSource source, EventDataTable table,
                                String eventName, List<Field> leaves, Map<String, List<Object>> enums) {
    for (Field leaf : leaves) {
      if (!enums.containsKey(leaf.path())) continue;
      List<Object> values = enums.get(leaf.path());
      if (values != null) {
        values = withoutNulls(values);
        if (values.isEmpty()) continue;
      }
      out.put(leaf.path(), new EventFieldDef(source.id(), table.id(), eventName, leaf, values));
    }
  }

  private static List<Object> withoutNulls(List<Object> values) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object v : values) if (v != null) out.add(v);
    return out;
  }

  private static void requireColumns(EventDataTable table, List<Field> roots) {
    Set<String> names = new HashSet<>();
    for (Field f : roots) names.add(f.name());
    List<String> required = new ArrayList<>(List.of(table.userIdField(), table.eventTimeField()));
    if (!table.hasEventNameAlias()) required.add(table.eventNameField());
    for (String col : required) {
      if (!names.contains(col)) throw new SchemaException("Table " + table.id() + " is missing required column '" + col + "'");
    }
  }

  private static Field withoutIgnored(EventDataTable table, Field f) {
    if (!f.hasSubFields() || f.type() != DataType.STRUCT) return f;
    List<Field> kept = new ArrayList<>();
    for (Field sf : f.subFields()) {
      if (!table.isIgnored(sf.path())) kept.add(withoutIgnored(table, sf));
    }
    return f.withSubFields(kept);
  }

  private static Field withKeys(Field map, List<String> keys) {
    if (keys == null || keys.isEmpty()) return map;
    DataType valueType = map.valueType() == null ? DataType.STRING : map.valueType();
    List<Field> children = new ArrayList<>(keys.size());
    for (String k : keys) if (k != null) children.add(Field.of(k, valueType));
    return map.withSubFields(children);
  }

  private static void register(Map<String, Field> registry, Field f) {
    for (Field x : f.flatten()) registry.put(x.path(), x);
  }
}
