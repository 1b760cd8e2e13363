package io.intellixity.tally.jdbc;

import io.intellixity.tally.compile.MetricQueryBuilder;
import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.discovery.DiscoveryScope;
import io.intellixity.tally.discovery.SchemaIntrospector;
import io.intellixity.tally.error.QueryCancelledException;
import io.intellixity.tally.error.QueryExecutionException;
import io.intellixity.tally.error.SchemaException;
import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.jdbc.dialect.Dialects;
import io.intellixity.tally.jdbc.dialect.SqlDialect;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.model.*;
import io.intellixity.tally.schema.SchemaRegistry;
import io.intellixity.tally.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.util.*;

/**
 * Binds one {@link EventDataSource} to its SQL dialect and pooled JDBC connection.\n
 *
 * Introspects tables for discovery, compiles metrics against a schema snapshot and executes
 * rendered statements. Every failing statement is logged with its SQL before the
 * {@link QueryExecutionException} propagates.\n
 */
public final class JdbcEventAdapter implements SchemaIntrospector {
  private static final Logger log = LoggerFactory.getLogger(JdbcEventAdapter.class);

  private final EventDataSource source;
  private final SqlDialect dialect;
  private final ConnectionCache connections;
  private final Clock clock;

  public JdbcEventAdapter(EventDataSource source, ConnectionCache connections) {
    this(source, Dialects.forType(source.connection().type()), connections);
  }

  public JdbcEventAdapter(EventDataSource source, SqlDialect dialect, ConnectionCache connections) {
    this(source, dialect, connections, Clock.systemDefaultZone());
  }

  public JdbcEventAdapter(EventDataSource source, SqlDialect dialect, ConnectionCache connections, Clock clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public EventDataSource source() { return source; }
  public SqlDialect dialect() { return dialect; }

  public JdbcHandle handle() { return connections.handle(source.connection()); }

  /** Drops the cached pool of this source and connects again. */
  public JdbcHandle reconnect() { return connections.reconnect(source.connection()); }

  /** A live connection from the pool; the caller closes it. */
  public java.sql.Connection open() {
    try {
      return handle().client().getConnection();
    } catch (SQLException e) {
      log.error("tally.jdbc op=OPEN_FAILED source={} error={}", source.id(), e.toString());
      throw new QueryExecutionException("Cannot connect to source " + source.id() + ": " + e.getMessage(), null, e);
    }
  }

  public void testConnection() {
    execute(SqlStatement.of(dialect.testQuery()), CancellationToken.create());
  }

  public CompiledMetricQuery compile(Metric metric, DiscoveredEventDataSource schema) {
    if (!schema.sourceId().equals(source.id())) {
      throw new SchemaException("Schema of source " + schema.sourceId() + " cannot compile against source " + source.id());
    }
    QueryPlan plan = new MetricQueryBuilder(schema, clock).build(metric);
    return new CompiledMetricQuery(metric, plan, dialect.render(plan), this);
  }

  public CompiledMetricQuery compile(Metric metric, SchemaRegistry registry) {
    return compile(metric, registry.require(source.id()));
  }

  public ResultTable execute(String sql) {
    return execute(SqlStatement.of(sql), CancellationToken.create());
  }

  public ResultTable execute(SqlStatement st, CancellationToken token) {
    Objects.requireNonNull(st, "st");
    Objects.requireNonNull(token, "token");
    token.throwIfCancelled("Query on source " + source.id());
    String jdbcSql = NamedParams.toJdbcSql(st.sql());
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("tally.jdbc op=QUERY source={} sql={} binds={}", source.id(), st.sql(), st.values());
    }
    try (java.sql.Connection c = handle().client().getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      List<Bind> binds = st.binds();
      for (int i = 0; i < binds.size(); i++) {
        Object v = binds.get(i).value();
        if (v == null) ps.setNull(i + 1, Types.NULL);
        else ps.setObject(i + 1, v);
      }
      ResultTable table;
      try (CancellationToken.Registration ignored = token.onCancel(() -> cancel(ps))) {
        try (ResultSet rs = ps.executeQuery()) {
          table = ResultTable.read(rs);
        }
      }
      log.debug("tally.jdbc op=QUERY_DONE source={} rows={} tookMs={}",
          source.id(), table.size(), (System.nanoTime() - start) / 1_000_000);
      return table;
    } catch (SQLException e) {
      String rendered = NamedParams.inline(st.sql(), st.values());
      if (token.isCancelled()) {
        log.info("tally.jdbc op=QUERY_CANCELLED source={} sql={}", source.id(), rendered);
        throw new QueryCancelledException("Query on source " + source.id() + " was cancelled", rendered, e);
      }
      log.error("tally.jdbc op=QUERY_FAILED source={} sql={} error={}", source.id(), rendered, e.toString());
      throw new QueryExecutionException("Query on source " + source.id() + " failed: " + e.getMessage()
          + "\nSQL: " + rendered, rendered, e);
    }
  }

  private void cancel(PreparedStatement ps) {
    try {
      ps.cancel();
    } catch (SQLException e) {
      log.warn("tally.jdbc op=CANCEL_FAILED source={} error={}", source.id(), e.toString());
    }
  }

  // ---- SchemaIntrospector ----

  @Override
  public List<Field> listFields(EventDataTable table) {
    List<Field> out = new ArrayList<>();
    try (java.sql.Connection c = open()) {
      DatabaseMetaData md = c.getMetaData();
      String schema = table.schema() != null ? table.schema() : source.connection().schema();
      try (ResultSet rs = md.getColumns(table.catalog(), schema, table.name(), null)) {
        while (rs.next()) {
          Field f = dialect.parseField(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME"));
          if (f.type() == DataType.STRUCT && !f.hasSubFields()) continue;
          out.add(f);
        }
      }
    } catch (SQLException e) {
      log.error("tally.jdbc op=LIST_FIELDS_FAILED source={} table={} error={}", source.id(), table.id(), e.toString());
      throw new QueryExecutionException("Cannot list columns of table " + table.id() + ": " + e.getMessage(), null, e);
    }
    if (out.isEmpty()) throw new SchemaException("Table " + table.id() + " does not exist or has no columns");
    log.debug("tally.jdbc op=LIST_FIELDS source={} table={} fields={}", source.id(), table.id(), out.size());
    return out;
  }

  @Override
  public List<String> listDistinctEventNames(EventDataTable table, DiscoveryScope scope) {
    if (table.hasEventNameAlias()) return List.of(table.eventNameAlias());
    ResultTable rt = execute(dialect.renderEventNames(table, scope), scope.cancellation());
    SortedSet<String> names = new TreeSet<>();
    for (Object v : rt.column(AbstractJdbcSqlDialect.EVENT_NAME_COL)) {
      if (v != null) names.add(v.toString());
    }
    return new ArrayList<>(names);
  }

  @Override
  public Map<String, Map<String, List<Object>>> sampleFieldEnumValues(EventDataTable table,
                                                                      List<Field> fields,
                                                                      boolean eventSpecific,
                                                                      int cardinalityLimit,
                                                                      DiscoveryScope scope) {
    if (fields.isEmpty()) return Map.of();
    ResultTable rt = execute(dialect.renderEnumSample(table, fields, eventSpecific, cardinalityLimit, scope),
        scope.cancellation());
    Map<String, Map<String, List<Object>>> out = new LinkedHashMap<>();
    for (int r = 0; r < rt.size(); r++) {
      String event = eventOf(rt, r, eventSpecific);
      if (event == null) continue;
      Map<String, List<Object>> values = new LinkedHashMap<>();
      for (int i = 0; i < fields.size(); i++) {
        values.put(fields.get(i).path(), dialect.decodeArrayAgg(rt.get(r, "_f" + i)));
      }
      out.put(event, values);
    }
    return out;
  }

  @Override
  public Map<String, List<String>> discoverMapKeys(EventDataTable table,
                                                   Field mapField,
                                                   boolean eventSpecific,
                                                   int cardinalityLimit,
                                                   DiscoveryScope scope) {
    ResultTable rt = execute(dialect.renderMapKeys(table, mapField, eventSpecific, cardinalityLimit, scope),
        scope.cancellation());
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (int r = 0; r < rt.size(); r++) {
      String event = eventOf(rt, r, eventSpecific);
      if (event == null) continue;
      List<Object> raw = dialect.decodeArrayAgg(rt.get(r, AbstractJdbcSqlDialect.KEYS_COL));
      if (raw == null) {
        out.put(event, null);
        continue;
      }
      SortedSet<String> keys = new TreeSet<>();
      for (Object k : raw) if (k != null) keys.add(k.toString());
      out.put(event, new ArrayList<>(keys));
    }
    return out;
  }

  private static String eventOf(ResultTable rt, int row, boolean eventSpecific) {
    if (!eventSpecific) return EventDef.ANY_EVENT;
    Object v = rt.get(row, AbstractJdbcSqlDialect.EVENT_NAME_COL);
    return v == null ? null : v.toString();
  }
}
