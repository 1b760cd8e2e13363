package io.intellixity.tally.expr;

import java.util.Objects;

public record IsNull(Expr expr, boolean negated) implements Expr {
  public IsNull {
    Objects.requireNonNull(expr, "expr");
  }
}
