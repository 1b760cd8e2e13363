package io.intellixity.tally.jdbc;

import io.intellixity.tally.model.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One lazily created {@link JdbcHandle} per distinct connection descriptor.\n
 *
 * Lookups are lock-free once a handle exists; creation is double-checked under a lock so
 * concurrent first use builds exactly one pool. {@link #invalidate} closes and drops a handle,
 * {@link #reconnect} replaces it.\n
 */
public final class ConnectionCache implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionCache.class);

  private final DataSourceFactory factory;
  private final Map<Connection, JdbcHandle> handles = new ConcurrentHashMap<>();
  private final Object lock = new Object();
  private final AtomicLong seq = new AtomicLong();

  public ConnectionCache() { this(new HikariDataSourceFactory()); }

  public ConnectionCache(DataSourceFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public JdbcHandle handle(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    JdbcHandle h = handles.get(connection);
    if (h != null) return h;
    synchronized (lock) {
      h = handles.get(connection);
      if (h == null) {
        DataSource ds = factory.create(connection);
        if (ds == null) throw new IllegalStateException("DataSourceFactory returned null for " + connection.type());
        h = new JdbcHandle(connection.type().name().toLowerCase(Locale.ROOT) + "#" + seq.incrementAndGet(), ds, connection);
        handles.put(connection, h);
        log.debug("tally.jdbc op=CONNECT handle={}", h.id());
      }
      return h;
    }
  }

  /** Closes and forgets the handle of {@code connection}; the next use connects again. */
  public void invalidate(Connection connection) {
    JdbcHandle h;
    synchronized (lock) {
      h = handles.remove(connection);
    }
    if (h != null) close(h);
  }

  public JdbcHandle reconnect(Connection connection) {
    invalidate(connection);
    return handle(connection);
  }

  public int size() { return handles.size(); }

  @Override
  public void close() {
    List<JdbcHandle> all;
    synchronized (lock) {
      all = new ArrayList<>(handles.values());
      handles.clear();
    }
    all.forEach(ConnectionCache::close);
  }

  private static void close(JdbcHandle h) {
    if (!(h.client() instanceof AutoCloseable c)) return;
    try {
      c.close();
      log.debug("tally.jdbc op=DISCONNECT handle={}", h.id());
    } catch (Exception e) {
      log.warn("tally.jdbc op=DISCONNECT_FAILED handle={} error={}", h.id(), e.toString());
    }
  }
}
