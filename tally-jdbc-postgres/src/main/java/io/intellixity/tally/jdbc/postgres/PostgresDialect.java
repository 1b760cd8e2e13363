package io.intellixity.tally.jdbc.postgres;

import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.Field;
import io.intellixity.tally.model.TimeWindow;

import java.util.Locale;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public ConnectionType connectionType() { return ConnectionType.POSTGRESQL; }
  @Override public String id() { return "postgres"; }

  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "postgresql");
    if (explicit != null) return explicit;
    String db = c.catalog() == null ? "" : c.catalog();
    return "jdbc:postgresql://" + hostPort(c, 5432) + "/" + db + urlQuery(c.urlParams());
  }

  /** Array columns are reported with an underscore prefix, e.g. {@code _text}. */
  @Override
  public Field parseField(String name, String nativeType) {
    if (nativeType != null && nativeType.startsWith("_")) {
      return Field.array(name, mapNativeType(nativeType.substring(1)));
    }
    return super.parseField(name, nativeType);
  }

  @Override
  protected String structAccess(String base, String member) {
    return "(" + base + ")." + quoteIdent(member);
  }

  @Override
  protected String addInterval(String expr, TimeWindow window) {
    TimeWindow w = normalized(window);
    return "(" + expr + " + INTERVAL '" + w.value() + " " + w.period().name().toLowerCase(Locale.ROOT) + "')";
  }
}
