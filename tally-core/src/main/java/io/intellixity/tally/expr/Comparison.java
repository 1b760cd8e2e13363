package io.intellixity.tally.expr;

import java.util.Objects;

public record Comparison(Expr left, Op op, Expr right) implements Expr {
  public enum Op {
    EQ("="), NEQ("<>"), GT(">"), LT("<"), GT_EQ(">="), LT_EQ("<=");

    private final String symbol;
    Op(String symbol) { this.symbol = symbol; }
    public String symbol() { return symbol; }
  }

  public Comparison {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(right, "right");
  }
}
