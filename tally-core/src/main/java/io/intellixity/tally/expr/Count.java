package io.intellixity.tally.expr;

import java.util.Objects;

public record Count(Expr expr, boolean distinct) implements Expr {
  public Count {
    Objects.requireNonNull(expr, "expr");
  }
}
