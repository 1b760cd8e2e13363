package io.intellixity.tally.jdbc.dialect;

import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.jdbc.SqlStatement;
import io.intellixity.tally.model.*;
import io.intellixity.tally.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private static final EventDataTable EVENTS = EventDataTable.of("events", "user_id", "event_time", "event_name")
      .withSchema("analytics");
  private static final LocalDateTime START = LocalDateTime.of(2023, 1, 1, 0, 0);
  private static final LocalDateTime END = LocalDateTime.of(2023, 2, 1, 0, 0);

  private final AnsiDialect dialect = new AnsiDialect();

  @Test
  void rendersSegmentationPlanWithBindsInOrder() {
    ColumnRef time = ColumnRef.of("t1", "event_time");
    ColumnRef user = ColumnRef.of("t1", "user_id");
    Expr where = Exprs.and(
        Exprs.eq(ColumnRef.of("t1", "event_name"), new Literal("page_view")),
        Exprs.gtEq(time, new Literal(START)),
        Exprs.lt(time, new Literal(END)));
    QueryPlan plan = new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(new DateTrunc(TimeGroup.DAY, time), "datetime"),
            new QueryPlan.SelectItem(Literal.NULL, "group"),
            new QueryPlan.SelectItem(new Count(user, true), "unique_user_count"),
            new QueryPlan.SelectItem(new Count(user, false), "event_count")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), where, List.of(1, 2), new DateRange(START, END));

    SqlStatement st = dialect.render(plan);

    assertEquals("SELECT DATE_TRUNC('day', t1.\"event_time\") AS \"datetime\", NULL AS \"group\", "
        + "COUNT(DISTINCT t1.\"user_id\") AS \"unique_user_count\", COUNT(t1.\"user_id\") AS \"event_count\" "
        + "FROM \"analytics\".\"events\" t1 "
        + "WHERE ((t1.\"event_name\" = :b1) AND (t1.\"event_time\" >= :b2) AND (t1.\"event_time\" < :b3)) "
        + "GROUP BY 1, 2", st.sql());
    assertEquals(List.of("page_view", Timestamp.valueOf(START), Timestamp.valueOf(END)), st.values());
  }

  @Test
  void rendersJoinsAndRatio() {
    ColumnRef u1 = ColumnRef.of("t1", "user_id");
    ColumnRef u2 = ColumnRef.of("t2", "user_id");
    Expr on = Exprs.and(Exprs.eq(u2, u1),
        Exprs.gt(ColumnRef.of("t2", "event_time"), ColumnRef.of("t1", "event_time")),
        Exprs.ltEq(ColumnRef.of("t2", "event_time"),
            new AddInterval(ColumnRef.of("t1", "event_time"), new TimeWindow(2, TimeGroup.WEEK))));
    QueryPlan plan = new QueryPlan(QueryPlan.Kind.CONVERSION,
        List.of(new QueryPlan.SelectItem(Literal.NULL, "datetime"),
            new QueryPlan.SelectItem(new Ratio(new Count(u2, true), new Count(u1, true)), "conversion_rate")),
        new QueryPlan.TableRef(EVENTS, "t1"),
        List.of(new QueryPlan.Join(new QueryPlan.TableRef(EVENTS, "t2"), on)),
        BoolLiteral.TRUE, List.of(1), new DateRange(START, END));

    String sql = dialect.render(plan).sql();
    assertTrue(sql.contains("(COUNT(DISTINCT t2.\"user_id\") * 1.0 / COUNT(DISTINCT t1.\"user_id\")) AS \"conversion_rate\""), sql);
    assertTrue(sql.contains(" LEFT JOIN \"analytics\".\"events\" t2 ON ((t2.\"user_id\" = t1.\"user_id\") AND "), sql);
    assertTrue(sql.contains("(t2.\"event_time\" <= (t1.\"event_time\" + INTERVAL '14' DAY))"), sql);
    assertFalse(sql.contains("WHERE"), sql);
    assertTrue(sql.endsWith("GROUP BY 1"), sql);
  }

  @Test
  void rendersUnionRelationsWithBindsInTextOrder() {
    EventDataTable signups = EventDataTable.single("signups", "user_id", "ts", "sign_up");
    QueryPlan.TableRef union = QueryPlan.TableRef.union(List.of(
        new QueryPlan.Branch(EVENTS, "t1_1", Exprs.eq(ColumnRef.of("t1_1", "event_name"), new Literal("page_view")),
            ColumnRef.of("t1_1", "country")),
        new QueryPlan.Branch(signups, "t1_2", BoolLiteral.TRUE, Literal.NULL)), "t1");
    QueryPlan plan = new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(ColumnRef.of("t1", QueryPlan.GROUP), "group"),
            new QueryPlan.SelectItem(new Count(ColumnRef.of("t1", QueryPlan.USER_ID), true), "unique_user_count")),
        union, List.of(), Exprs.gtEq(ColumnRef.of("t1", QueryPlan.EVENT_TIME), new Literal(START)),
        List.of(1), new DateRange(START, END));

    SqlStatement st = dialect.render(plan);

    assertEquals("SELECT t1.\"_group\" AS \"group\", COUNT(DISTINCT t1.\"_user_id\") AS \"unique_user_count\" "
        + "FROM (SELECT t1_1.\"user_id\" AS \"_user_id\", t1_1.\"event_time\" AS \"_event_time\", "
        + "t1_1.\"country\" AS \"_group\" FROM \"analytics\".\"events\" t1_1 WHERE (t1_1.\"event_name\" = :b1) "
        + "UNION ALL SELECT t1_2.\"user_id\" AS \"_user_id\", t1_2.\"ts\" AS \"_event_time\", NULL AS \"_group\" "
        + "FROM \"signups\" t1_2) t1 "
        + "WHERE (t1.\"_event_time\" >= :b2) GROUP BY 1", st.sql());
    assertEquals(List.of("page_view", Timestamp.valueOf(START)), st.values());
  }

  @Test
  void tableRefIsEitherATableOrAUnion() {
    assertThrows(IllegalArgumentException.class, () -> new QueryPlan.TableRef(null, "t1", List.of()));
    QueryPlan.Branch b = new QueryPlan.Branch(EVENTS, "t1_1", BoolLiteral.TRUE, Literal.NULL);
    assertThrows(IllegalArgumentException.class, () -> new QueryPlan.TableRef(EVENTS, "t1", List.of(b)));
  }

  @Test
  void rendersPredicateShapes() {
    ColumnRef c = new ColumnRef("t1", "props", List.of(new ColumnRef.PathStep("plan", true)));
    Expr e = new Junction(io.intellixity.tally.segment.BinaryOperator.OR, List.of(
        new Not(new Like(c, new Literal("%pro%"))),
        new InList(c, List.of(new Literal("a"), new Literal("b"))),
        new IsNull(ColumnRef.of("t1", "x"), true)));
    QueryPlan plan = new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(Literal.NULL, "datetime")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), e, List.of(), new DateRange(START, END));
    SqlStatement st = dialect.render(plan);
    assertEquals("SELECT NULL AS \"datetime\" FROM \"analytics\".\"events\" t1 WHERE "
        + "((NOT (t1.\"props\"['plan'] LIKE :b1)) OR (t1.\"props\"['plan'] IN (:b2, :b3)) OR (t1.\"x\" IS NOT NULL))",
        st.sql());
    assertEquals(List.of("%pro%", "a", "b"), st.values());
  }

  @Test
  void namedGroupingUsesAliases() {
    AbstractJdbcSqlDialect named = new AbstractJdbcSqlDialect() {
      @Override public ConnectionType connectionType() { return ConnectionType.SQLITE; }
      @Override public String id() { return "named"; }
      @Override public String jdbcUrl(Connection connection) { return null; }
      @Override public GroupByStyle groupByStyle() { return GroupByStyle.NAMED; }
    };
    QueryPlan plan = new QueryPlan(QueryPlan.Kind.SEGMENTATION,
        List.of(new QueryPlan.SelectItem(Literal.NULL, "datetime"), new QueryPlan.SelectItem(Literal.NULL, "group"),
            new QueryPlan.SelectItem(new Count(ColumnRef.of("t1", "user_id"), false), "event_count")),
        new QueryPlan.TableRef(EVENTS, "t1"), List.of(), BoolLiteral.TRUE, List.of(1, 2), new DateRange(START, END));
    assertTrue(named.render(plan).sql().endsWith(" GROUP BY \"datetime\", \"group\""));
  }

  @Test
  void enumSampleGroupsByEventOnlyWhenEventSpecific() {
    DiscoveryScope scope = new DiscoveryScope(new DateRange(START, END), 500, CancellationToken.create());
    Field country = Field.of("country", DataType.STRING);
    Field plan = Field.map("props", DataType.STRING, List.of(Field.of("plan", DataType.STRING))).subFields().get(0);

    SqlStatement specific = dialect.renderEnumSample(EVENTS, List.of(country, plan), true, 300, scope);
    assertEquals("WITH _sample AS (SELECT _t.\"event_name\" AS _event_name, _t.\"country\" AS _f0, "
        + "_t.\"props\"['plan'] AS _f1, ROW_NUMBER() OVER (PARTITION BY _t.\"event_name\" ORDER BY random()) AS _rn "
        + "FROM \"analytics\".\"events\" _t WHERE ((_t.\"event_time\" >= :b1) AND (_t.\"event_time\" < :b2))) "
        + "SELECT _event_name, CASE WHEN COUNT(DISTINCT _f0) < 300 THEN ARRAY_AGG(DISTINCT _f0) ELSE NULL END AS _f0, "
        + "CASE WHEN COUNT(DISTINCT _f1) < 300 THEN ARRAY_AGG(DISTINCT _f1) ELSE NULL END AS _f1 "
        + "FROM _sample WHERE _rn <= 500 GROUP BY _event_name", specific.sql());

    SqlStatement generic = dialect.renderEnumSample(EVENTS, List.of(country), false, 300, scope);
    assertFalse(generic.sql().contains("GROUP BY"));
    assertTrue(generic.sql().contains("SELECT CASE WHEN COUNT(DISTINCT _f0) < 300"));
  }

  @Test
  void aliasTablesSampleWithoutPartition() {
    EventDataTable single = EventDataTable.single("signups", "user_id", "ts", "sign_up");
    DiscoveryScope scope = new DiscoveryScope(null, 10, CancellationToken.create());
    SqlStatement st = dialect.renderMapKeys(single, Field.map("props", DataType.STRING, List.of()), true, 50, scope);
    assertEquals("WITH _sample AS (SELECT 'sign_up' AS _event_name, _t.\"props\" AS _m, "
        + "ROW_NUMBER() OVER (ORDER BY random()) AS _rn FROM \"signups\" _t) "
        + "SELECT _event_name, CASE WHEN cardinality(map_keys_agg(_m)) < 50 THEN map_keys_agg(_m) ELSE NULL END AS _keys "
        + "FROM _sample WHERE _rn <= 10 GROUP BY _event_name", st.sql());
    assertTrue(st.binds().isEmpty());
  }

  @Test
  void mapFieldsNeedDialectSupport() {
    AbstractJdbcSqlDialect plain = new AbstractJdbcSqlDialect() {
      @Override public ConnectionType connectionType() { return ConnectionType.POSTGRESQL; }
      @Override public String id() { return "plain"; }
      @Override public String jdbcUrl(Connection connection) { return null; }
    };
    DiscoveryScope scope = new DiscoveryScope(null, 10, CancellationToken.create());
    assertThrows(UnsupportedFeatureException.class,
        () -> plain.renderMapKeys(EVENTS, Field.map("props", DataType.STRING, List.of()), false, 5, scope));
  }

  @Test
  void decodesCommonDateTimeRepresentations() {
    LocalDateTime t = LocalDateTime.of(2023, 3, 26, 0, 0);
    assertEquals(t, dialect.decodeDateTime(Timestamp.valueOf(t)));
    assertEquals(t, dialect.decodeDateTime("2023-03-26 00:00:00"));
    assertEquals(t, dialect.decodeDateTime("2023-03-26"));
    assertEquals(t, dialect.decodeDateTime("2023-03-26T00:00:00+00:00"));
    assertNull(dialect.decodeDateTime(null));
  }

  @Test
  void decodesJsonArrays() {
    assertEquals(List.of("a", 1), dialect.decodeArrayAgg("[\"a\",1]"));
    assertNull(dialect.decodeArrayAgg(null));
  }

  @Test
  void buildsUrlsFromParts() {
    assertEquals("?a=1&b=2", AbstractJdbcSqlDialect.urlQuery(java.util.Map.of("b", "2", "a", "1")));
    assertEquals("jdbc:ansi:x", dialect.jdbcUrl(Connection.ofUrl(ConnectionType.POSTGRESQL, "ansi:x")));
    assertEquals("jdbc:ansi:x", dialect.jdbcUrl(Connection.ofUrl(ConnectionType.POSTGRESQL, "x")));
  }
}
