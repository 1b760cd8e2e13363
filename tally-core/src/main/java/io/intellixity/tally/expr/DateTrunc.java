package io.intellixity.tally.expr;

import io.intellixity.tally.model.TimeGroup;

import java.util.Objects;

public record DateTrunc(TimeGroup timeGroup, Expr expr) implements Expr {
  public DateTrunc {
    Objects.requireNonNull(timeGroup, "timeGroup");
    Objects.requireNonNull(expr, "expr");
    if (timeGroup == TimeGroup.TOTAL) throw new IllegalArgumentException("TOTAL has no truncation");
  }
}
