package io.intellixity.tally.expr;

import io.intellixity.tally.model.TimeWindow;

import java.util.Objects;

public record AddInterval(Expr expr, TimeWindow window) implements Expr {
  public AddInterval {
    Objects.requireNonNull(expr, "expr");
    Objects.requireNonNull(window, "window");
  }
}
