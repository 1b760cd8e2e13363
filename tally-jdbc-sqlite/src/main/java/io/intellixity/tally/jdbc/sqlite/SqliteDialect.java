package io.intellixity.tally.jdbc.sqlite;

import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.jdbc.dialect.GroupByStyle;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.model.TimeWindow;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * SQLite dialect.\n
 *
 * Timestamps are TEXT in {@code yyyy-MM-dd HH:mm:ss} form, so they are bound and compared as
 * strings. SQLite has no array type: distinct values are joined with a marker and split client side.\n
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  static final String VALUE_MARKER = "###";

  private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  @Override public ConnectionType connectionType() { return ConnectionType.SQLITE; }
  @Override public String id() { return "sqlite"; }
  @Override public GroupByStyle groupByStyle() { return GroupByStyle.NAMED; }
  @Override protected boolean looselyTyped() { return true; }

  /** The database file is the explicit url or, failing that, {@code host}; none means in-memory. */
  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "sqlite");
    if (explicit != null) return explicit;
    String file = c.host() == null || c.host().isBlank() ? ":memory:" : c.host();
    return "jdbc:sqlite:" + file;
  }

  @Override
  protected String dateTrunc(TimeGroup tg, String expr) {
    String fmt = switch (tg) {
      case SECOND -> "%Y-%m-%dT%H:%M:%S";
      case MINUTE -> "%Y-%m-%dT%H:%M:00";
      case HOUR -> "%Y-%m-%dT%H:00:00";
      case DAY -> "%Y-%m-%dT00:00:00";
      case WEEK -> null;
      case MONTH -> "%Y-%m-01T00:00:00";
      case YEAR -> "%Y-01-01T00:00:00";
      case QUARTER, TOTAL -> throw new UnsupportedFeatureException("SQLite cannot truncate timestamps to " + tg);
    };
    if (fmt == null) return "datetime(date(" + expr + ", 'weekday 0', '-6 days'))";
    return "datetime(strftime('" + fmt + "', " + expr + "))";
  }

  @Override
  protected String addInterval(String expr, TimeWindow window) {
    TimeWindow w = normalized(window);
    return "datetime(" + expr + ", '+" + w.value() + " " + w.period().name().toLowerCase(Locale.ROOT) + "s')";
  }

  @Override
  protected String structAccess(String base, String member) {
    throw new UnsupportedFeatureException("Struct fields are not supported by the sqlite dialect");
  }

  @Override
  protected String distinctArrayAgg(String expr) {
    return "coalesce(group_concat(DISTINCT " + expr + " || '" + VALUE_MARKER + "'), '')";
  }

  @Override
  public Object bindValue(Object value) {
    if (value instanceof LocalDateTime t) return TS.format(t);
    return value;
  }

  @Override
  public List<Object> decodeArrayAgg(Object value) {
    if (!(value instanceof String s)) return super.decodeArrayAgg(value);
    if (s.isEmpty()) return new ArrayList<>();
    if (s.endsWith(VALUE_MARKER)) s = s.substring(0, s.length() - VALUE_MARKER.length());
    return new ArrayList<>(Arrays.asList((Object[]) s.split(VALUE_MARKER + ",", -1)));
  }
}
