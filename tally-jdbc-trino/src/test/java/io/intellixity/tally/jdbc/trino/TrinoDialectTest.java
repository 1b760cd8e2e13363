package io.intellixity.tally.jdbc.trino;

import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.jdbc.SqlStatement;
import io.intellixity.tally.jdbc.dialect.Dialects;
import io.intellixity.tally.model.*;
import io.intellixity.tally.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TrinoDialectTest {
  private static final EventDataTable EVENTS = EventDataTable.of("events", "user_id", "event_time", "event_name")
      .withSchema("web").withCatalog("hive");
  private static final LocalDateTime START = LocalDateTime.of(2023, 1, 1, 0, 0);
  private static final LocalDateTime END = LocalDateTime.of(2023, 1, 8, 0, 0);

  private final TrinoDialect d = new TrinoDialect();

  @Test
  void bothTrinoFamilyDialectsAreRegistered() {
    assertInstanceOf(TrinoDialect.class, Dialects.forType(ConnectionType.TRINO));
    assertInstanceOf(AthenaDialect.class, Dialects.forType(ConnectionType.ATHENA));
  }

  @Test
  void inlinesTimestampsAndAccessesMapKeys() {
    ColumnRef time = ColumnRef.of("t1", "event_time");
    ColumnRef plan = new ColumnRef("t1", "props", List.of(new ColumnRef.PathStep("plan", true)));
    Expr where = Exprs.and(Exprs.eq(plan, new Literal("pro")), Exprs.gtEq(time, new Literal(START)), Exprs.lt(time, new Literal(END)));
    SqlStatement st = d.render(new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(new DateTrunc(TimeGroup.WEEK, time), "datetime")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), where, List.of(1), new DateRange(START, END)));

    assertEquals("SELECT DATE_TRUNC('week', t1.\"event_time\") AS \"datetime\" FROM \"hive\".\"web\".\"events\" t1 "
        + "WHERE ((element_at(t1.\"props\", 'plan') = :b1) AND (t1.\"event_time\" >= TIMESTAMP '2023-01-01 00:00:00') "
        + "AND (t1.\"event_time\" < TIMESTAMP '2023-01-08 00:00:00')) GROUP BY 1", st.sql());
    assertEquals(List.of("pro"), st.values());
  }

  @Test
  void addsIntervalsWithDateAdd() {
    String sql = d.render(new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(new AddInterval(ColumnRef.of("t1", "event_time"), new TimeWindow(2, TimeGroup.QUARTER)), "x")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), BoolLiteral.TRUE, List.of(), new DateRange(START, END))).sql();
    assertTrue(sql.contains("date_add('quarter', 2, t1.\"event_time\")"), sql);
  }

  @Test
  void discoversMapKeysWithCardinalityGuard() {
    DiscoveryScope scope = new DiscoveryScope(new DateRange(START, END), 1000, CancellationToken.create());
    SqlStatement st = d.renderMapKeys(EVENTS, Field.map("props", DataType.STRING, List.of()), false, 300, scope);
    assertTrue(st.sql().contains("CASE WHEN cardinality(array_distinct(flatten(array_agg(map_keys(_m))))) < 300 "
        + "THEN array_distinct(flatten(array_agg(map_keys(_m)))) ELSE NULL END AS _keys"), st.sql());
    assertTrue(st.binds().isEmpty());
  }

  @Test
  void parsesRowAndMapTypes() {
    Field ctx = d.parseField("ctx", "row(os varchar, version integer)");
    assertEquals(2, ctx.subFields().size());
    assertEquals(DataType.NUMBER, ctx.subFields().get(1).type());
    assertEquals(DataType.MAP, d.parseField("props", "map(varchar, varchar)").type());
    assertEquals(DataType.DATETIME, d.parseField("ts", "timestamp(3)").type());
  }

  @Test
  void buildsTrinoAndAthenaUrls() {
    Connection trino = new Connection(ConnectionType.TRINO, null, "trino", null, "hive", "web", "u", null, null, null);
    assertEquals("jdbc:trino://trino:8080/hive/web", d.jdbcUrl(trino));

    Connection athena = new Connection(ConnectionType.ATHENA, null, null, null, "AwsDataCatalog", "web", null, null,
        null, Map.of(AthenaDialect.REGION, "eu-west-1", AthenaDialect.S3_STAGING_DIR, "s3://bucket/out"));
    assertEquals("jdbc:awsathena://AwsRegion=eu-west-1;S3OutputLocation=s3://bucket/out;Catalog=AwsDataCatalog;Schema=web",
        new AthenaDialect().jdbcUrl(athena));
    assertThrows(IllegalArgumentException.class,
        () -> new AthenaDialect().jdbcUrl(new Connection(ConnectionType.ATHENA, null, null, null, null, null, null, null, null, null)));
  }
}
