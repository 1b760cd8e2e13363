package io.intellixity.tally.jdbc.dialect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.error.QueryExecutionException;
import io.intellixity.tally.error.TypeMappingException;
import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.jdbc.Bind;
import io.intellixity.tally.jdbc.SqlStatement;
import io.intellixity.tally.model.*;
import io.intellixity.tally.segment.BinaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - compiled metric plans: select list, left joins, filter, grouping\n
 * - the expression tree produced by the segment compiler\n
 * - discovery queries over a per-event random sample\n
 *
 * DB-specific dialects override hooks for quoting, date truncation, interval arithmetic,
 * nested attribute access, array aggregation and value conversion.\n
 */
public abstract class AbstractJdbcSqlDialect implements SqlDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcSqlDialect.class);

  protected static final ObjectMapper JSON = new ObjectMapper();

  public static final String EVENT_NAME_COL = "_event_name";
  public static final String KEYS_COL = "_keys";
  protected static final String SAMPLE_CTE = "_sample";
  protected static final String ROW_NUM_COL = "_rn";
  protected static final String MAP_COL = "_m";
  protected static final String DISCOVERY_ALIAS = "_t";

  private static final Set<String> STRING_TYPES = Set.of(
      "varchar", "char", "character", "text", "string", "nvarchar", "nchar", "uuid", "json", "jsonb",
      "clob", "tinytext", "mediumtext", "longtext", "enum", "name", "citext", "bpchar");
  private static final Set<String> NUMBER_TYPES = Set.of(
      "int", "integer", "int2", "int4", "int8", "smallint", "bigint", "tinyint", "mediumint", "decimal",
      "dec", "numeric", "number", "real", "double", "float", "float4", "float8", "serial", "bigserial",
      "smallserial", "money");
  private static final Set<String> BOOL_TYPES = Set.of("bool", "boolean", "bit");
  private static final Set<String> DATETIME_TYPES = Set.of(
      "timestamp", "timestamptz", "timestamp_ntz", "timestamp_ltz", "datetime", "date");

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Object value) {
      binds.add(new Bind(value));
      return ":b" + (n++);
    }
    public List<Bind> binds() { return binds; }
  }

  private final NativeTypeParser types = new NativeTypeParser(this::mapNativeType);

  @Override public GroupByStyle groupByStyle() { return GroupByStyle.ORDINAL; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** The connection's explicit URL, with the {@code jdbc:} prefix added when missing; null when absent. */
  protected static String explicitUrl(Connection c, String scheme) {
    if (c.url() == null || c.url().isBlank()) return null;
    String u = c.url().trim();
    if (u.startsWith("jdbc:")) return u;
    return u.startsWith(scheme + ":") ? "jdbc:" + u : "jdbc:" + scheme + ":" + u;
  }

  /** {@code ?k=v&k2=v2}, or empty. */
  protected static String urlQuery(Map<String, String> params) {
    if (params.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, String> e : new TreeMap<>(params).entrySet()) parts.add(e.getKey() + "=" + e.getValue());
    return "?" + String.join("&", parts);
  }

  protected static String hostPort(Connection c, int defaultPort) {
    if (c.host() == null || c.host().isBlank()) {
      throw new IllegalArgumentException(c.type() + " connection requires a host or an explicit url");
    }
    return c.host() + ":" + (c.port() == null ? defaultPort : c.port());
  }

  /** Loosely typed engines fall back to STRING for unknown native types instead of failing. */
  protected boolean looselyTyped() { return false; }

  @Override
  public DataType mapNativeType(String nativeType) {
    String k = scalarKey(nativeType);
    if (STRING_TYPES.contains(k)) return DataType.STRING;
    if (NUMBER_TYPES.contains(k)) return DataType.NUMBER;
    if (BOOL_TYPES.contains(k)) return DataType.BOOL;
    if (DATETIME_TYPES.contains(k)) return DataType.DATETIME;
    if (looselyTyped()) {
      log.warn("tally.dialect op=TYPE_FALLBACK dialect={} nativeType={} fallback=STRING", id(), nativeType);
      return DataType.STRING;
    }
    throw new TypeMappingException("Unsupported native type '" + nativeType + "' for dialect " + id());
  }

  @Override
  public Field parseField(String name, String nativeType) {
    if ((nativeType == null || nativeType.isBlank()) && looselyTyped()) return Field.of(name, DataType.STRING);
    return types.parse(name, nativeType);
  }

  /** {@code "double precision"} -> {@code double}, {@code "varchar(255)"} -> {@code varchar}. */
  protected static String scalarKey(String nativeType) {
    if (nativeType == null) return "";
    String s = nativeType.toLowerCase(Locale.ROOT).replaceAll("\\(.*?\\)", " ").trim();
    int sp = s.indexOf(' ');
    return sp < 0 ? s : s.substring(0, sp);
  }

  // ---- metric plans ----

  @Override
  public SqlStatement render(QueryPlan plan) {
    RenderCtx ctx = new RenderCtx();
    List<String> items = new ArrayList<>();
    for (QueryPlan.SelectItem si : plan.select()) {
      items.add(renderExpr(si.expr(), ctx) + " AS " + quoteIdent(si.alias()));
    }
    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(String.join(", ", items));
    sql.append(" FROM ").append(relation(plan.from(), ctx));
    for (QueryPlan.Join j : plan.joins()) {
      sql.append(" LEFT JOIN ").append(relation(j.table(), ctx));
      sql.append(" ON ").append(renderExpr(j.on(), ctx));
    }
    if (!BoolLiteral.TRUE.equals(plan.where())) {
      sql.append(" WHERE ").append(renderExpr(plan.where(), ctx));
    }
    if (!plan.groupBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (int pos : plan.groupBy()) {
        parts.add(groupByStyle() == GroupByStyle.ORDINAL
            ? String.valueOf(pos)
            : quoteIdent(plan.select().get(pos - 1).alias()));
      }
      sql.append(" GROUP BY ").append(String.join(", ", parts));
    }
    return new SqlStatement(sql.toString(), ctx.binds());
  }

  /** {@code table alias}, or {@code (SELECT .. UNION ALL SELECT ..) alias} for a union. */
  protected String relation(QueryPlan.TableRef ref, RenderCtx ctx) {
    if (!ref.isUnion()) return tableRef(ref.table()) + " " + ref.alias();
    List<String> selects = new ArrayList<>(ref.union().size());
    for (QueryPlan.Branch b : ref.union()) {
      EventDataTable t = b.table();
      StringBuilder sel = new StringBuilder("SELECT ");
      sel.append(renderExpr(ColumnRef.of(b.alias(), t.userIdField()), ctx)).append(" AS ").append(quoteIdent(QueryPlan.USER_ID));
      sel.append(", ").append(renderExpr(ColumnRef.of(b.alias(), t.eventTimeField()), ctx)).append(" AS ").append(quoteIdent(QueryPlan.EVENT_TIME));
      sel.append(", ").append(renderExpr(b.group(), ctx)).append(" AS ").append(quoteIdent(QueryPlan.GROUP));
      sel.append(" FROM ").append(tableRef(t)).append(' ').append(b.alias());
      if (!BoolLiteral.TRUE.equals(b.where())) sel.append(" WHERE ").append(renderExpr(b.where(), ctx));
      selects.add(sel.toString());
    }
    return "(" + String.join(" UNION ALL ", selects) + ") " + ref.alias();
  }

  protected String tableRef(EventDataTable t) {
    List<String> parts = new ArrayList<>(3);
    if (t.catalog() != null && !t.catalog().isBlank()) parts.add(quoteIdent(t.catalog()));
    if (t.schema() != null && !t.schema().isBlank()) parts.add(quoteIdent(t.schema()));
    parts.add(quoteIdent(t.name()));
    return String.join(".", parts);
  }

  protected String renderExpr(Expr e, RenderCtx ctx) {
    if (e == null) throw new IllegalArgumentException("null expression");
    if (e instanceof ColumnRef c) return column(c, ctx);
    if (e instanceof Literal l) return literal(l.value(), ctx);
    if (e instanceof BoolLiteral b) return b.value() ? "(1 = 1)" : "(1 = 0)";
    if (e instanceof Comparison c) {
      String l = renderExpr(c.left(), ctx);
      String r = renderExpr(c.right(), ctx);
      return "(" + l + " " + c.op().symbol() + " " + r + ")";
    }
    if (e instanceof Like lk) {
      String l = renderExpr(lk.expr(), ctx);
      return "(" + l + " LIKE " + renderExpr(lk.pattern(), ctx) + ")";
    }
    if (e instanceof InList in) {
      String l = renderExpr(in.expr(), ctx);
      List<String> vs = new ArrayList<>(in.values().size());
      for (Expr v : in.values()) vs.add(renderExpr(v, ctx));
      return "(" + l + " IN (" + String.join(", ", vs) + "))";
    }
    if (e instanceof IsNull isn) {
      return "(" + renderExpr(isn.expr(), ctx) + (isn.negated() ? " IS NOT NULL)" : " IS NULL)");
    }
    if (e instanceof Not n) return "(NOT " + renderExpr(n.expr(), ctx) + ")";
    if (e instanceof Junction j) {
      List<String> parts = new ArrayList<>(j.parts().size());
      for (Expr p : j.parts()) parts.add(renderExpr(p, ctx));
      return "(" + String.join(j.op() == BinaryOperator.AND ? " AND " : " OR ", parts) + ")";
    }
    if (e instanceof DateTrunc dt) return dateTrunc(dt.timeGroup(), renderExpr(dt.expr(), ctx));
    if (e instanceof AddInterval ai) return addInterval(renderExpr(ai.expr(), ctx), ai.window());
    if (e instanceof Count c) return "COUNT(" + (c.distinct() ? "DISTINCT " : "") + renderExpr(c.expr(), ctx) + ")";
    if (e instanceof Ratio r) {
      String num = renderExpr(r.numerator(), ctx);
      return "(" + num + " * 1.0 / " + renderExpr(r.denominator(), ctx) + ")";
    }
    throw new IllegalArgumentException("Unknown expression: " + e);
  }

  protected String column(ColumnRef c, RenderCtx ctx) {
    String out = c.tableAlias() + "." + quoteIdent(c.column());
    for (ColumnRef.PathStep step : c.path()) {
      out = step.mapKey() ? mapAccess(out, step.name()) : structAccess(out, step.name());
    }
    return out;
  }

  protected String structAccess(String base, String member) {
    return base + "." + quoteIdent(member);
  }

  protected String mapAccess(String base, String key) {
    throw new UnsupportedFeatureException("Map fields are not supported by the " + id() + " dialect");
  }

  protected String literal(Object value, RenderCtx ctx) {
    if (value == null) return "NULL";
    if (value instanceof LocalDateTime t) return timestampLiteral(t, ctx);
    return ctx.add(bindValue(value));
  }

  protected String timestampLiteral(LocalDateTime t, RenderCtx ctx) {
    return ctx.add(bindValue(t));
  }

  protected static String stringLiteral(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected String dateTrunc(TimeGroup tg, String expr) {
    return "DATE_TRUNC('" + tg.name().toLowerCase(Locale.ROOT) + "', " + expr + ")";
  }

  protected String addInterval(String expr, TimeWindow window) {
    TimeWindow w = normalized(window);
    return "(" + expr + " + INTERVAL '" + w.value() + "' " + w.period().name() + ")";
  }

  /** Weeks become days and quarters months, for engines without those interval units. */
  protected static TimeWindow normalized(TimeWindow w) {
    return switch (w.period()) {
      case WEEK -> new TimeWindow(w.value() * 7, TimeGroup.DAY);
      case QUARTER -> new TimeWindow(w.value() * 3, TimeGroup.MONTH);
      default -> w;
    };
  }

  protected String randomFn() { return "random()"; }

  protected String distinctArrayAgg(String expr) { return "ARRAY_AGG(DISTINCT " + expr + ")"; }

  /** Distinct keys over all rows of the map column {@code expr}. */
  protected String mapKeysAgg(String expr) {
    throw new UnsupportedFeatureException("Map fields are not supported by the " + id() + " dialect");
  }

  protected String arrayLength(String expr) { return "cardinality(" + expr + ")"; }

  // ---- discovery ----

  @Override
  public SqlStatement renderEventNames(EventDataTable table, DiscoveryScope scope) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT DISTINCT " + eventNameExpr(table) + " AS " + EVENT_NAME_COL
        + " FROM " + tableRef(table) + " " + DISCOVERY_ALIAS + rangeFilter(table, scope.range(), ctx);
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement renderEnumSample(EventDataTable table, List<Field> fields, boolean eventSpecific, int limit,
                                       DiscoveryScope scope) {
    if (fields.isEmpty()) throw new IllegalArgumentException("no fields to sample");
    RenderCtx ctx = new RenderCtx();
    List<String> inner = new ArrayList<>(fields.size());
    List<String> outer = new ArrayList<>(fields.size() + 1);
    if (eventSpecific) outer.add(EVENT_NAME_COL);
    for (int i = 0; i < fields.size(); i++) {
      String alias = "_f" + i;
      inner.add(column(fieldRef(fields.get(i)), ctx) + " AS " + alias);
      outer.add("CASE WHEN COUNT(DISTINCT " + alias + ") < " + limit
          + " THEN " + distinctArrayAgg(alias) + " ELSE NULL END AS " + alias);
    }
    String sql = sampleCte(table, inner, scope, ctx)
        + " SELECT " + String.join(", ", outer)
        + " FROM " + SAMPLE_CTE + " WHERE " + ROW_NUM_COL + " <= " + scope.sampleSize()
        + (eventSpecific ? " GROUP BY " + EVENT_NAME_COL : "");
    return new SqlStatement(sql, ctx.binds());
  }

  @Override
  public SqlStatement renderMapKeys(EventDataTable table, Field mapField, boolean eventSpecific, int limit,
                                    DiscoveryScope scope) {
    if (mapField.type() != DataType.MAP) throw new IllegalArgumentException("not a map field: " + mapField);
    RenderCtx ctx = new RenderCtx();
    String keys = mapKeysAgg(MAP_COL);
    String inner = column(fieldRef(mapField), ctx) + " AS " + MAP_COL;
    String sql = sampleCte(table, List.of(inner), scope, ctx)
        + " SELECT " + (eventSpecific ? EVENT_NAME_COL + ", " : "")
        + "CASE WHEN " + arrayLength(keys) + " < " + limit + " THEN " + keys + " ELSE NULL END AS " + KEYS_COL
        + " FROM " + SAMPLE_CTE + " WHERE " + ROW_NUM_COL + " <= " + scope.sampleSize()
        + (eventSpecific ? " GROUP BY " + EVENT_NAME_COL : "");
    return new SqlStatement(sql, ctx.binds());
  }

  /** Up to the scope's sample size of randomly ordered rows per event name. */
  protected String sampleCte(EventDataTable table, List<String> items, DiscoveryScope scope, RenderCtx ctx) {
    String ev = eventNameExpr(table);
    String over = table.hasEventNameAlias()
        ? "ORDER BY " + randomFn()
        : "PARTITION BY " + ev + " ORDER BY " + randomFn();
    return "WITH " + SAMPLE_CTE + " AS (SELECT " + ev + " AS " + EVENT_NAME_COL + ", "
        + String.join(", ", items)
        + ", ROW_NUMBER() OVER (" + over + ") AS " + ROW_NUM_COL
        + " FROM " + tableRef(table) + " " + DISCOVERY_ALIAS + rangeFilter(table, scope.range(), ctx) + ")";
  }

  protected String eventNameExpr(EventDataTable table) {
    return table.hasEventNameAlias()
        ? stringLiteral(table.eventNameAlias())
        : DISCOVERY_ALIAS + "." + quoteIdent(table.eventNameField());
  }

  private String rangeFilter(EventDataTable table, DateRange range, RenderCtx ctx) {
    if (range == null) return "";
    ColumnRef time = ColumnRef.of(DISCOVERY_ALIAS, table.eventTimeField());
    Expr where = Exprs.and(Exprs.gtEq(time, new Literal(range.start())), Exprs.lt(time, new Literal(range.end())));
    return " WHERE " + renderExpr(where, ctx);
  }

  /** Column expression of a discovered field: struct members, then at most one trailing map key. */
  protected static ColumnRef fieldRef(Field f) {
    List<String> structPath;
    String mapKey = null;
    if (f.parentType() == DataType.MAP) {
      structPath = Arrays.asList(f.parentPath().split("\\."));
      mapKey = f.name();
    } else {
      structPath = Arrays.asList(f.path().split("\\."));
    }
    List<ColumnRef.PathStep> steps = new ArrayList<>();
    for (int i = 1; i < structPath.size(); i++) steps.add(new ColumnRef.PathStep(structPath.get(i), false));
    if (mapKey != null) steps.add(new ColumnRef.PathStep(mapKey, true));
    return new ColumnRef(DISCOVERY_ALIAS, structPath.get(0), steps);
  }

  // ---- values ----

  @Override
  public Object bindValue(Object value) {
    if (value instanceof LocalDateTime t) return Timestamp.valueOf(t);
    return value;
  }

  @Override
  public LocalDateTime decodeDateTime(Object value) {
    if (value == null) return null;
    if (value instanceof LocalDateTime t) return t;
    if (value instanceof Timestamp ts) return ts.toLocalDateTime();
    if (value instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay();
    if (value instanceof LocalDate d) return d.atStartOfDay();
    if (value instanceof OffsetDateTime t) return t.toLocalDateTime();
    if (value instanceof ZonedDateTime t) return t.toLocalDateTime();
    if (value instanceof java.util.Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneId.systemDefault());
    String s = value.toString().trim();
    if (s.length() == 10) return LocalDate.parse(s).atStartOfDay();
    s = s.replace(' ', 'T');
    int plus = s.indexOf('+', 10);
    if (plus > 0) s = s.substring(0, plus);
    if (s.endsWith("Z")) s = s.substring(0, s.length() - 1);
    return LocalDateTime.parse(s);
  }

  @Override
  public List<Object> decodeArrayAgg(Object value) {
    if (value == null) return null;
    if (value instanceof List<?> l) return new ArrayList<>(l);
    if (value instanceof Object[] a) return new ArrayList<>(Arrays.asList(a));
    if (value instanceof String s) return parseJsonArray(s);
    throw new QueryExecutionException("Unexpected aggregated value of type " + value.getClass().getName(), null);
  }

  protected static List<Object> parseJsonArray(String s) {
    if (s.isBlank()) return new ArrayList<>();
    try {
      return JSON.readValue(s, new TypeReference<List<Object>>() {});
    } catch (JsonProcessingException e) {
      throw new QueryExecutionException("Aggregated value is not a JSON array: " + s, null, e);
    }
  }
}
