package io.intellixity.tally.jdbc.mysql;

import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * MySQL 8 dialect.\n
 *
 * MySQL has no array aggregate; distinct values are collected as the keys of a JSON object,
 * with NULL mapped to a marker because JSON object keys cannot be NULL.\n
 */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  static final String NULL_MARKER = "##NULL##";

  @Override public ConnectionType connectionType() { return ConnectionType.MYSQL; }
  @Override public String id() { return "mysql"; }

  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "mysql");
    if (explicit != null) return explicit;
    String db = c.catalog() != null ? c.catalog() : (c.schema() == null ? "" : c.schema());
    return "jdbc:mysql://" + hostPort(c, 3306) + "/" + db + urlQuery(c.urlParams());
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String randomFn() { return "RAND()"; }

  @Override
  protected String dateTrunc(TimeGroup tg, String expr) {
    String fmt = switch (tg) {
      case SECOND -> "%Y-%m-%dT%H:%i:%S";
      case MINUTE -> "%Y-%m-%dT%H:%i:00";
      case HOUR -> "%Y-%m-%dT%H:00:00";
      case DAY -> "%Y-%m-%d";
      case WEEK -> null;
      case MONTH -> "%Y-%m-01";
      case YEAR -> "%Y-01-01";
      case QUARTER, TOTAL -> throw new UnsupportedFeatureException("MySQL cannot truncate timestamps to " + tg);
    };
    if (fmt == null) return "date_add(date(" + expr + "), interval -weekday(" + expr + ") day)";
    return "timestamp(date_format(" + expr + ", '" + fmt + "'))";
  }

  @Override
  protected String addInterval(String expr, TimeWindow window) {
    return "DATE_ADD(" + expr + ", INTERVAL " + window.value() + " " + window.period().name() + ")";
  }

  @Override
  protected String structAccess(String base, String member) {
    throw new UnsupportedFeatureException("Struct fields are not supported by the mysql dialect");
  }

  @Override
  protected String distinctArrayAgg(String expr) {
    return "json_keys(json_objectagg(coalesce(" + expr + ", '" + NULL_MARKER + "'), ''))";
  }

  @Override
  public List<Object> decodeArrayAgg(Object value) {
    List<Object> raw = super.decodeArrayAgg(value);
    if (raw == null) return null;
    List<Object> out = new ArrayList<>(raw.size());
    for (Object v : raw) out.add(NULL_MARKER.equals(v) ? null : v);
    return out;
  }
}
