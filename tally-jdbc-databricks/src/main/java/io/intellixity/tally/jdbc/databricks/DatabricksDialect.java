package io.intellixity.tally.jdbc.databricks;

import io.intellixity.tally.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;

import java.util.Map;

/**
 * Databricks SQL dialect.\n
 *
 * Requires {@code extra_configs.http_path} of the SQL warehouse; authenticates with a personal
 * access token passed as the connection password.\n
 */
public final class DatabricksDialect extends AbstractJdbcSqlDialect {
  public static final String HTTP_PATH = "http_path";

  @Override public ConnectionType connectionType() { return ConnectionType.DATABRICKS; }
  @Override public String id() { return "databricks"; }

  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "databricks");
    if (explicit != null) return explicit;
    String httpPath = c.extraConfig(HTTP_PATH);
    if (httpPath == null || httpPath.isBlank()) {
      throw new IllegalArgumentException("Databricks connections require extra_configs." + HTTP_PATH);
    }
    StringBuilder sb = new StringBuilder("jdbc:databricks://").append(hostPort(c, 443));
    sb.append("/").append(c.schema() == null ? "default" : c.schema());
    sb.append(";transportMode=http;ssl=1;AuthMech=3;httpPath=").append(httpPath);
    if (c.catalog() != null) sb.append(";ConnCatalog=").append(c.catalog());
    c.urlParams().forEach((k, v) -> sb.append(';').append(k).append('=').append(v));
    return sb.toString();
  }

  @Override
  public Map<String, String> driverProperties(Connection c) {
    String token = c.password();
    return token == null ? Map.of("UID", "token") : Map.of("UID", "token", "PWD", token);
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String randomFn() { return "rand()"; }

  @Override
  protected String mapAccess(String base, String key) {
    return base + "[" + stringLiteral(key) + "]";
  }

  @Override
  protected String distinctArrayAgg(String expr) { return "to_json(collect_set(" + expr + "))"; }

  @Override
  protected String mapKeysAgg(String expr) {
    return "array_distinct(flatten(collect_list(map_keys(" + expr + "))))";
  }

  @Override
  protected String arrayLength(String expr) { return "size(" + expr + ")"; }
}
