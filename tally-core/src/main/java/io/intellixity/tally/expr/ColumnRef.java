package io.intellixity.tally.expr;

import java.util.List;
import java.util.Objects;

/**
 * Column of an aliased table, optionally descending into nested attributes.\n
 * Each {@link PathStep} is either a struct member or a map key lookup.\n
 */
public record ColumnRef(String tableAlias, String column, List<PathStep> path) implements Expr {
  public ColumnRef {
    Objects.requireNonNull(tableAlias, "tableAlias");
    Objects.requireNonNull(column, "column");
    path = path == null ? List.of() : List.copyOf(path);
  }

  public static ColumnRef of(String tableAlias, String column) { return new ColumnRef(tableAlias, column, List.of()); }

  public boolean nested() { return !path.isEmpty(); }

  public record PathStep(String name, boolean mapKey) {
    public PathStep {
      Objects.requireNonNull(name, "name");
    }
  }
}
