package io.intellixity.tally.jdbc.postgres;

import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.jdbc.SqlStatement;
import io.intellixity.tally.jdbc.dialect.Dialects;
import io.intellixity.tally.model.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final EventDataTable EVENTS = EventDataTable.of("events", "user_id", "event_time", "event_name");
  private static final DateRange RANGE = new DateRange(LocalDateTime.of(2023, 1, 1, 0, 0), LocalDateTime.of(2023, 1, 8, 0, 0));

  private final PostgresDialect d = new PostgresDialect();

  private SqlStatement select(Expr expr) {
    return d.render(new QueryPlan(QueryPlan.Kind.SEGMENTATION, List.of(new QueryPlan.SelectItem(expr, "x")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), BoolLiteral.TRUE, List.of(), RANGE));
  }

  @Test
  void isRegisteredForPostgresConnections() {
    assertInstanceOf(PostgresDialect.class, Dialects.forType(ConnectionType.POSTGRESQL));
  }

  @Test
  void buildsUrlFromParts() {
    Connection c = new Connection(ConnectionType.POSTGRESQL, null, "db.local", null, "events", "public", "u", null,
        Map.of("sslmode", "require"), null);
    assertEquals("jdbc:postgresql://db.local:5432/events?sslmode=require", d.jdbcUrl(c));
    assertEquals("jdbc:postgresql://h/db", d.jdbcUrl(Connection.ofUrl(ConnectionType.POSTGRESQL, "postgresql://h/db")));
  }

  @Test
  void rendersCompositeMemberAccessAndIntervals() {
    ColumnRef os = new ColumnRef("t1", "ctx", List.of(new ColumnRef.PathStep("os", false)));
    assertEquals("SELECT (t1.\"ctx\").\"os\" AS \"x\" FROM \"events\" t1", select(os).sql());

    String sql = select(new AddInterval(ColumnRef.of("t1", "event_time"), new TimeWindow(3, TimeGroup.HOUR))).sql();
    assertTrue(sql.contains("(t1.\"event_time\" + INTERVAL '3 hour')"), sql);

    sql = select(new AddInterval(ColumnRef.of("t1", "event_time"), new TimeWindow(1, TimeGroup.QUARTER))).sql();
    assertTrue(sql.contains("(t1.\"event_time\" + INTERVAL '3 month')"), sql);
    assertFalse(sql.contains("quarter"), sql);

    sql = select(new DateTrunc(TimeGroup.QUARTER, ColumnRef.of("t1", "event_time"))).sql();
    assertTrue(sql.contains("DATE_TRUNC('quarter', t1.\"event_time\")"), sql);
  }

  @Test
  void rejectsMapAccess() {
    ColumnRef plan = new ColumnRef("t1", "props", List.of(new ColumnRef.PathStep("plan", true)));
    assertThrows(UnsupportedFeatureException.class, () -> select(plan));
  }

  @Test
  void mapsPostgresTypeNames() {
    assertEquals(DataType.NUMBER, d.parseField("a", "int8").type());
    assertEquals(DataType.STRING, d.parseField("a", "jsonb").type());
    assertEquals(DataType.DATETIME, d.parseField("a", "timestamptz").type());
    Field tags = d.parseField("tags", "_text");
    assertEquals(DataType.ARRAY, tags.type());
    assertEquals(DataType.STRING, tags.valueType());
  }
}
