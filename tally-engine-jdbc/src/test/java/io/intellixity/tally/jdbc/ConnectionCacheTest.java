package io.intellixity.tally.jdbc;

import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionCacheTest {
  private static final Connection PG = Connection.ofUrl(ConnectionType.POSTGRESQL, "jdbc:postgresql://db/events");
  private static final Connection OTHER = Connection.ofUrl(ConnectionType.POSTGRESQL, "jdbc:postgresql://db/other");

  /** DataSource stub that records close() calls. */
  private static final class Pools implements DataSourceFactory {
    final AtomicInteger created = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();

    @Override
    public DataSource create(Connection connection) {
      created.incrementAndGet();
      return (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(),
          new Class<?>[]{DataSource.class, AutoCloseable.class},
          (proxy, method, args) -> {
            if (method.getName().equals("close")) {
              closed.incrementAndGet();
              return null;
            }
            if (method.getName().equals("hashCode")) return System.identityHashCode(proxy);
            if (method.getName().equals("equals")) return proxy == args[0];
            throw new UnsupportedOperationException(method.getName());
          });
    }
  }

  @Test
  void concurrentFirstUseCreatesOnePool() throws Exception {
    Pools pools = new Pools();
    ConnectionCache cache = new ConnectionCache(pools);
    int threads = 16;
    ExecutorService exec = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<JdbcHandle>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(exec.submit(() -> {
          start.await();
          return cache.handle(PG);
        }));
      }
      start.countDown();
      Set<JdbcHandle> handles = ConcurrentHashMap.newKeySet();
      for (Future<JdbcHandle> f : futures) handles.add(f.get(10, TimeUnit.SECONDS));
      assertEquals(1, handles.size());
      assertEquals(1, pools.created.get());
    } finally {
      exec.shutdownNow();
    }
  }

  @Test
  void distinctDescriptorsGetDistinctPools() {
    Pools pools = new Pools();
    ConnectionCache cache = new ConnectionCache(pools);
    assertNotSame(cache.handle(PG), cache.handle(OTHER));
    assertSame(cache.handle(PG), cache.handle(Connection.ofUrl(ConnectionType.POSTGRESQL, "jdbc:postgresql://db/events")));
    assertEquals(2, cache.size());
  }

  @Test
  void invalidateClosesAndReconnectReplaces() {
    Pools pools = new Pools();
    ConnectionCache cache = new ConnectionCache(pools);
    JdbcHandle first = cache.handle(PG);

    JdbcHandle second = cache.reconnect(PG);
    assertNotSame(first, second);
    assertEquals(1, pools.closed.get());
    assertEquals(2, pools.created.get());

    cache.invalidate(PG);
    assertEquals(0, cache.size());
    assertEquals(2, pools.closed.get());

    cache.invalidate(PG);
    assertEquals(2, pools.closed.get());
  }

  @Test
  void closeReleasesEveryPool() {
    Pools pools = new Pools();
    ConnectionCache cache = new ConnectionCache(pools);
    cache.handle(PG);
    cache.handle(OTHER);
    cache.close();
    assertEquals(2, pools.closed.get());
    assertEquals(0, cache.size());
  }
}
