package io.intellixity.tally.jdbc.databricks;

import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.jdbc.dialect.Dialects;
import io.intellixity.tally.model.*;
import io.intellixity.tally.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DatabricksDialectTest {
  private static final EventDataTable EVENTS = EventDataTable.of("events", "user_id", "event_time", "event_name");
  private static final DateRange RANGE = new DateRange(LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 8, 0, 0));

  private final DatabricksDialect d = new DatabricksDialect();

  @Test
  void isRegisteredForDatabricksConnections() {
    assertInstanceOf(DatabricksDialect.class, Dialects.forType(ConnectionType.DATABRICKS));
  }

  @Test
  void requiresHttpPath() {
    Connection missing = new Connection(ConnectionType.DATABRICKS, null, "dbc.cloud", null, null, null, null, null, null, null);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> d.jdbcUrl(missing));
    assertTrue(ex.getMessage().contains("http_path"));

    Connection ok = new Connection(ConnectionType.DATABRICKS, null, "dbc.cloud", null, "main", "web", null,
        SecretResolver.constant("dapi-1"), null, Map.of(DatabricksDialect.HTTP_PATH, "/sql/1.0/warehouses/abc"));
    assertEquals("jdbc:databricks://dbc.cloud:443/web;transportMode=http;ssl=1;AuthMech=3;"
        + "httpPath=/sql/1.0/warehouses/abc;ConnCatalog=main", d.jdbcUrl(ok));
    assertEquals(Map.of("UID", "token", "PWD", "dapi-1"), d.driverProperties(ok));
  }

  @Test
  void rendersMapAndStructAccessWithBackticks() {
    ColumnRef plan = new ColumnRef("t1", "props", List.of(new ColumnRef.PathStep("plan", true)));
    ColumnRef os = new ColumnRef("t1", "ctx", List.of(new ColumnRef.PathStep("os", false)));
    String sql = d.render(new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(plan, "a"), new QueryPlan.SelectItem(os, "b")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), BoolLiteral.TRUE, List.of(), RANGE)).sql();
    assertEquals("SELECT t1.`props`['plan'] AS `a`, t1.`ctx`.`os` AS `b` FROM `events` t1", sql);
  }

  @Test
  void discoveryUsesSparkAggregates() {
    DiscoveryScope scope = new DiscoveryScope(null, 100, CancellationToken.create());
    String enums = d.renderEnumSample(EVENTS, List.of(Field.of("country", DataType.STRING)), false, 10, scope).sql();
    assertTrue(enums.contains("to_json(collect_set(_f0))"), enums);
    assertTrue(enums.contains("ORDER BY rand()"), enums);

    String keys = d.renderMapKeys(EVENTS, Field.map("props", DataType.STRING, List.of()), true, 10, scope).sql();
    assertTrue(keys.contains("CASE WHEN size(array_distinct(flatten(collect_list(map_keys(_m))))) < 10"), keys);
    assertEquals(List.of("de", "fr"), d.decodeArrayAgg("[\"de\",\"fr\"]"));
  }

  @Test
  void parsesSparkTypeNames() {
    Field ctx = d.parseField("ctx", "STRUCT<os:STRING,screen:STRUCT<w:INT,h:INT>>");
    assertEquals(List.of("ctx.os", "ctx.screen.w", "ctx.screen.h"), ctx.leaves().stream().map(Field::path).toList());
    assertEquals(DataType.NUMBER, d.parseField("props", "MAP<STRING,BIGINT>").valueType());
  }
}
