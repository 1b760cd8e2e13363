package io.intellixity.tally.jdbc.sqlite;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/** Writes event rows into a SQLite database file. */
final class SqliteFixture implements AutoCloseable {
  private final Connection conn;
  private final PreparedStatement insert;

  SqliteFixture(Path file) throws SQLException {
    conn = DriverManager.getConnection("jdbc:sqlite:" + file);
    try (Statement s = conn.createStatement()) {
      s.execute("CREATE TABLE events (user_id TEXT, event_time TIMESTAMP, event_name TEXT, country TEXT, plan TEXT)");
      s.execute("CREATE TABLE signups (user_id TEXT, ts TIMESTAMP, source TEXT)");
    }
    conn.setAutoCommit(false);
    insert = conn.prepareStatement("INSERT INTO events VALUES (?, ?, ?, ?, ?)");
  }

  SqliteFixture event(String user, String time, String name, String country) throws SQLException {
    insert.setString(1, user);
    insert.setString(2, time);
    insert.setString(3, name);
    insert.setString(4, country);
    insert.setString(5, "pro");
    insert.addBatch();
    return this;
  }

  SqliteFixture signup(String user, String time, String source) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO signups VALUES (?, ?, ?)")) {
      ps.setString(1, user);
      ps.setString(2, time);
      ps.setString(3, source);
      ps.executeUpdate();
    }
    return this;
  }

  @Override
  public void close() throws SQLException {
    insert.executeBatch();
    conn.commit();
    insert.close();
    conn.close();
  }
}
