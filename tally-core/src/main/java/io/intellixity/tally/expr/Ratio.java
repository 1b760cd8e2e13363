package io.intellixity.tally.expr;

import java.util.Objects;

/** Floating point division; integer operands are widened before dividing. */
public record Ratio(Expr numerator, Expr denominator) implements Expr {
  public Ratio {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
  }
}
