package io.intellixity.tally.jdbc;

import java.util.List;
import java.util.Objects;

/** Rendered SQL with {@code :bN} named placeholders and their values in appearance order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }

  public static SqlStatement of(String sql) { return new SqlStatement(sql, List.of()); }

  public List<Object> values() { return binds.stream().map(Bind::value).toList(); }
}
