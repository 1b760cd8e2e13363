package io.intellixity.tally.expr;

import io.intellixity.tally.segment.BinaryOperator;

import java.util.List;
import java.util.Objects;

/** AND/OR of two or more parts; always rendered fully parenthesized. */
public record Junction(BinaryOperator op, List<Expr> parts) implements Expr {
  public Junction {
    Objects.requireNonNull(op, "op");
    parts = List.copyOf(parts);
    if (parts.size() < 2) throw new IllegalArgumentException("junction needs at least two parts");
  }
}
