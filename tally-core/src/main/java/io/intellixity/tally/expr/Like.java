package io.intellixity.tally.expr;

import java.util.Objects;

public record Like(Expr expr, Expr pattern) implements Expr {
  public Like {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(pattern, "pattern");
  }
}
