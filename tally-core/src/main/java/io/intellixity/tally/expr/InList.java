package io.intellixity.tally.expr;

import java.util.List;
import java.util.Objects;

/** Membership test; callers never build an empty list. */
public record InList(Expr expr, List<Expr> values) implements Expr {
  public InList {
    Objects.requireNonNull(expr, "expr");
    values = List.copyOf(values);
    if (values.isEmpty()) throw new IllegalArgumentException("IN list must not be empty");
  }
}
