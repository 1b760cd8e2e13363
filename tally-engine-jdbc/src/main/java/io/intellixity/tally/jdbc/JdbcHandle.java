package io.intellixity.tally.jdbc;

import io.intellixity.tally.model.Connection;

import javax.sql.DataSource;
import java.util.Objects;

/** A pooled data source created for one connection descriptor. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final Connection connection;

  public JdbcHandle(String id, DataSource client, Connection connection) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public Connection connection() { return connection; }
  public String schema() { return connection.schema(); }
}
