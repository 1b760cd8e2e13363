package io.intellixity.tally.expr;

public record BoolLiteral(boolean value) implements Expr {
  public static final BoolLiteral TRUE = new BoolLiteral(true);
  public static final BoolLiteral FALSE = new BoolLiteral(false);

  public static BoolLiteral of(boolean value) { return value ? TRUE : FALSE; }
}
