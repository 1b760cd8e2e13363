package io.intellixity.tally.model;

import java.util.Locale;

/** Closed set of supported warehouse families; selects the dialect implementation. */
public enum ConnectionType {
  POSTGRESQL,
  SQLITE,
  MYSQL,
  TRINO,
  ATHENA,
  DATABRICKS;

  public static ConnectionType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("connection type is blank");
    return ConnectionType.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
