package io.intellixity.tally.examples.web;

import io.intellixity.tally.discovery.DiscoveryResult;
import io.intellixity.tally.examples.service.DiscoveryService;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.EventDef;
import io.intellixity.tally.model.EventFieldDef;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sources/{sourceId}")
public final class DiscoveryController {
  private final DiscoveryService discovery;

  public DiscoveryController(DiscoveryService discovery) {
    this.discovery = discovery;
  }

  public record FieldView(String path, String type, List<Object> values) {}

  public record EventView(String name, String table, List<FieldView> fields) {}

  public record SchemaView(String sourceId, long version, List<EventView> events, Map<String, String> failures) {}

  @PostMapping("/discover")
  public SchemaView discover(@PathVariable("sourceId") String sourceId) {
    DiscoveryResult r = discovery.discover(sourceId);
    Map<String, String> failures = new LinkedHashMap<>();
    r.failures().forEach((table, e) -> failures.put(table, e.getMessage()));
    return view(r.snapshot(), failures);
  }

  @GetMapping("/events")
  public SchemaView events(@PathVariable("sourceId") String sourceId) {
    return view(discovery.schema(sourceId), Map.of());
  }

  private static SchemaView view(DiscoveredEventDataSource s, Map<String, String> failures) {
    List<EventView> events = new ArrayList<>();
    for (String name : s.eventNames()) {
      EventDef def = s.event(name).orElseThrow();
      List<FieldView> fields = new ArrayList<>();
      for (EventFieldDef f : def.fields().values()) {
        fields.add(new FieldView(f.path(), f.field().type().name(), f.enums()));
      }
      events.add(new EventView(name, def.tableId(), fields));
    }
    return new SchemaView(s.sourceId(), s.version(), events, failures);
  }
}
