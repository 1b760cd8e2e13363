package io.intellixity.tally.jdbc;

import io.intellixity.tally.model.Connection;

import javax.sql.DataSource;

/** Creates the physical data source behind a cached {@link JdbcHandle}. */
@FunctionalInterface
public interface DataSourceFactory {
  DataSource create(Connection connection);
}
