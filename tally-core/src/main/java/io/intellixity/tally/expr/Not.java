package io.intellixity.tally.expr;

import java.util.Objects;

public record Not(Expr expr) implements Expr {
  public Not {
    Objects.requireNonNull(expr, "expr");
  }
}
