package io.intellixity.tally.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tally.jdbc.dialect.Dialects;
import io.intellixity.tally.jdbc.dialect.SqlDialect;
import io.intellixity.tally.model.Connection;

import javax.sql.DataSource;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** HikariCP pools; the JDBC URL comes from the connection type's dialect. */
public final class HikariDataSourceFactory implements DataSourceFactory {
  public static final String POOL_SIZE = "pool_size";

  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final int defaultPoolSize;

  public HikariDataSourceFactory() { this(4); }

  public HikariDataSourceFactory(int defaultPoolSize) {
    if (defaultPoolSize <= 0) throw new IllegalArgumentException("defaultPoolSize must be > 0");
    this.defaultPoolSize = defaultPoolSize;
  }

  @Override
  public DataSource create(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("tally-" + connection.type().name().toLowerCase(Locale.ROOT) + "-" + POOL_SEQ.incrementAndGet());
    SqlDialect dialect = Dialects.forType(connection.type());
    hc.setJdbcUrl(dialect.jdbcUrl(connection));
    dialect.driverProperties(connection).forEach(hc::addDataSourceProperty);
    if (connection.userName() != null) hc.setUsername(connection.userName());
    String password = connection.password();
    if (password != null) hc.setPassword(password);
    String size = connection.extraConfig(POOL_SIZE);
    hc.setMaximumPoolSize(size == null ? defaultPoolSize : Integer.parseInt(size));
    return new HikariDataSource(hc);
  }
}
