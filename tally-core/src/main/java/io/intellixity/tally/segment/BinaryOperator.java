package io.intellixity.tally.segment;

import java.util.Locale;

public enum BinaryOperator {
  AND,
  OR;

  public static BinaryOperator parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("binary operator is blank");
    return BinaryOperator.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
