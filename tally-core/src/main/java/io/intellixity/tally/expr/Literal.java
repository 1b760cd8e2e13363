package io.intellixity.tally.expr;

/** A value bound as a parameter, or SQL NULL when {@code value} is null. */
public record Literal(Object value) implements Expr {
  public static final Literal NULL = new Literal(null);

  public boolean isNull() { return value == null; }
}
