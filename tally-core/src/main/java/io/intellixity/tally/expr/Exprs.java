package io.intellixity.tally.expr;

import io.intellixity.tally.segment.BinaryOperator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Convenience builders for common expression shapes. */
public final class Exprs {
  private Exprs() {}

  public static Expr and(Expr... parts) { return junction(BinaryOperator.AND, Arrays.asList(parts)); }

  public static Expr and(List<Expr> parts) { return junction(BinaryOperator.AND, parts); }

  public static Expr or(Expr... parts) { return junction(BinaryOperator.OR, Arrays.asList(parts)); }

  /** Drops TRUE operands of an AND; a single remaining operand is returned as is. */
  public static Expr junction(BinaryOperator op, List<Expr> parts) {
    List<Expr> kept = new ArrayList<>();
    for (Expr p : parts) {
      if (op == BinaryOperator.AND && BoolLiteral.TRUE.equals(p)) continue;
      kept.add(p);
    }
    if (kept.isEmpty()) return BoolLiteral.TRUE;
    if (kept.size() == 1) return kept.get(0);
    return new Junction(op, kept);
  }

  public static Comparison eq(Expr l, Expr r) { return new Comparison(l, Comparison.Op.EQ, r); }
  public static Comparison gt(Expr l, Expr r) { return new Comparison(l, Comparison.Op.GT, r); }
  public static Comparison gtEq(Expr l, Expr r) { return new Comparison(l, Comparison.Op.GT_EQ, r); }
  public static Comparison lt(Expr l, Expr r) { return new Comparison(l, Comparison.Op.LT, r); }
  public static Comparison ltEq(Expr l, Expr r) { return new Comparison(l, Comparison.Op.LT_EQ, r); }

  public static Literal value(Object v) { return v == null ? Literal.NULL : new Literal(v); }
}
