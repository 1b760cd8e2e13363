package io.intellixity.tally.model;

import java.util.Map;
import java.util.Objects;

/**
 * Warehouse connection descriptor. Either {@code url} is given verbatim or the dialect
 * assembles one from host/port/catalog/schema. Equal descriptors share one cached pool.
 */
public record Connection(ConnectionType type,
                         String url,
                         String host,
                         Integer port,
                         String catalog,
                         String schema,
                         String userName,
                         SecretResolver secretResolver,
                         Map<String, String> urlParams,
                         Map<String, String> extraConfigs) {
  public Connection {
    Objects.requireNonNull(type, "type");
    urlParams = urlParams == null ? Map.of() : Map.copyOf(urlParams);
    extraConfigs = extraConfigs == null ? Map.of() : Map.copyOf(extraConfigs);
  }

  public static Connection ofUrl(ConnectionType type, String url) {
    return new Connection(type, url, null, null, null, null, null, null, null, null);
  }

  public Connection withCredentials(String userName, SecretResolver secretResolver) {
    return new Connection(type, url, host, port, catalog, schema, userName, secretResolver, urlParams, extraConfigs);
  }

  public String password() { return secretResolver == null ? null : secretResolver.resolve(); }

  public String extraConfig(String key) { return extraConfigs.get(key); }
}
