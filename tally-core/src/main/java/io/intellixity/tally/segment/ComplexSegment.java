package io.intellixity.tally.segment;

import java.util.Objects;

public final class ComplexSegment implements Segment {
  private final Segment left;
  private final BinaryOperator operator;
  private final Segment right;

  public ComplexSegment(Segment left, BinaryOperator operator, Segment right) {
    this.left = Objects.requireNonNull(left, "left");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.right = Objects.requireNonNull(right, "right");
  }

  public Segment left() { return left; }
  public BinaryOperator operator() { return operator; }
  public Segment right() { return right; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ComplexSegment c)) return false;
    return left.equals(c.left) && operator == c.operator && right.equals(c.right);
  }

  @Override
  public int hashCode() { return Objects.hash(left, operator, right); }

  @Override
  public String toString() { return "(" + left + " " + operator + " " + right + ")"; }
}
