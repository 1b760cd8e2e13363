package io.intellixity.tally.jdbc.dialect;

import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.util.TallyFactoriesLoader;

import java.util.EnumMap;
import java.util.Map;

/** Dialects found on the classpath, one per {@link ConnectionType}. */
public final class Dialects {
  private static Map<ConnectionType, SqlDialect> loaded;

  private Dialects() {}

  public static SqlDialect forType(ConnectionType type) {
    SqlDialect d = all().get(type);
    if (d == null) {
      throw new UnsupportedFeatureException("No SQL dialect on the classpath for connection type " + type
          + " (add the matching tally-jdbc-* module)");
    }
    return d;
  }

  public static synchronized Map<ConnectionType, SqlDialect> all() {
    if (loaded == null) {
      Map<ConnectionType, SqlDialect> m = new EnumMap<>(ConnectionType.class);
      for (SqlDialect d : TallyFactoriesLoader.load(SqlDialect.class)) m.putIfAbsent(d.connectionType(), d);
      loaded = Map.copyOf(m);
    }
    return loaded;
  }
}
