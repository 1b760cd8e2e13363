package io.intellixity.tally.jdbc.trino;

import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.TimeWindow;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Trino dialect; also the base of {@link AthenaDialect}.\n
 *
 * Supports nested {@code row(...)} members and {@code map(k, v)} key lookups. Timestamps are
 * rendered as typed literals since the engine does not coerce bound timestamp parameters.\n
 */
public class TrinoDialect extends AbstractJdbcSqlDialect {
  private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter TS_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

  @Override public ConnectionType connectionType() { return ConnectionType.TRINO; }
  @Override public String id() { return "trino"; }

  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "trino");
    if (explicit != null) return explicit;
    StringBuilder sb = new StringBuilder("jdbc:trino://").append(hostPort(c, 8080));
    if (c.catalog() != null) {
      sb.append('/').append(c.catalog());
      if (c.schema() != null) sb.append('/').append(c.schema());
    }
    return sb.append(urlQuery(c.urlParams())).toString();
  }

  @Override
  protected String mapAccess(String base, String key) {
    return "element_at(" + base + ", " + stringLiteral(key) + ")";
  }

  @Override
  protected String addInterval(String expr, TimeWindow window) {
    return "date_add('" + window.period().name().toLowerCase(Locale.ROOT) + "', " + window.value() + ", " + expr + ")";
  }

  @Override
  protected String timestampLiteral(LocalDateTime t, RenderCtx ctx) {
    return "TIMESTAMP '" + (t.getNano() == 0 ? TS : TS_MILLIS).format(t) + "'";
  }

  @Override
  protected String mapKeysAgg(String expr) {
    return "array_distinct(flatten(array_agg(map_keys(" + expr + "))))";
  }
}
