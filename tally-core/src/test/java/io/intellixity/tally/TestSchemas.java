package io.intellixity.tally;

import io.intellixity.tally.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built snapshot used across core tests:\n
 *
 * <pre>
 * events  (user_id, event_time, event_name, country, price, props map{plan, a.b}, device struct{os})
 *         events page_view, purchase
 * signups (user_id, ts, source), single event sign_up
 * </pre>
 */
public final class TestSchemas {
  public static final String SOURCE = "shop";
  public static final EventDataTable EVENTS = EventDataTable.of("events", "user_id", "event_time", "event_name");
  public static final EventDataTable SIGNUPS = EventDataTable.single("signups", "user_id", "ts", "sign_up");

  private TestSchemas() {}

  public static DiscoveredEventDataSource shop() {
    List<Field> eventRoots = List.of(
        Field.of("user_id", DataType.STRING),
        Field.of("event_time", DataType.DATETIME),
        Field.of("event_name", DataType.STRING),
        Field.of("country", DataType.STRING),
        Field.of("price", DataType.NUMBER),
        Field.map("props", DataType.STRING, List.of(Field.of("plan", DataType.STRING), Field.of("a.b", DataType.STRING))),
        Field.struct("device", List.of(Field.of("os", DataType.STRING))));
    Map<String, Field> eventFields = register(eventRoots);
    Map<String, EventDef> events = new LinkedHashMap<>();
    for (String e : List.of("page_view", "purchase")) {
      events.put(e, event(EVENTS, e, eventFields, "country", "price", "props.plan", "props.a.b", "device.os"));
    }

    List<Field> signupRoots = List.of(
        Field.of("user_id", DataType.STRING),
        Field.of("ts", DataType.DATETIME),
        Field.of("source", DataType.STRING));
    Map<String, Field> signupFields = register(signupRoots);
    Map<String, EventDef> signups = Map.of("sign_up", event(SIGNUPS, "sign_up", signupFields, "source"));

    return new DiscoveredEventDataSource(SOURCE, 1, List.of(
        new DiscoveredTable(EVENTS, eventFields, events),
        new DiscoveredTable(SIGNUPS, signupFields, signups)));
  }

  /** Snapshot holding only the events table. */
  public static DiscoveredEventDataSource eventsOnly() {
    DiscoveredEventDataSource full = shop();
    return new DiscoveredEventDataSource(SOURCE, 1, List.of(full.table(EVENTS.id()).orElseThrow()));
  }

  private static Map<String, Field> register(List<Field> roots) {
    Map<String, Field> out = new LinkedHashMap<>();
    for (Field r : roots) for (Field f : r.flatten()) out.put(f.path(), f);
    return out;
  }

  private static EventDef event(EventDataTable t, String name, Map<String, Field> fields, String... paths) {
    Map<String, EventFieldDef> defs = new LinkedHashMap<>();
    for (String p : paths) defs.put(p, new EventFieldDef(SOURCE, t.id(), name, fields.get(p), null));
    return new EventDef(SOURCE, t.id(), name, defs);
  }
}
