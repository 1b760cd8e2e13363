package io.intellixity.tally.segment;

import java.util.Locale;

/** Leaf comparison of a {@link SimpleSegment}; every constant has its own stable code. */
public enum Operator {
  EQ(1),
  NEQ(2),
  GT(3),
  LT(4),
  GT_EQ(5),
  LT_EQ(6),
  LIKE(7),
  NOT_LIKE(8),
  ANY_OF(9),
  NONE_OF(10),
  IS_NULL(11),
  IS_NOT_NULL(12);

  private final int code;

  Operator(int code) { this.code = code; }

  public int code() { return code; }

  /** Null tests carry no right-hand value. */
  public boolean ignoresRight() { return this == IS_NULL || this == IS_NOT_NULL; }

  public boolean takesList() { return this == ANY_OF || this == NONE_OF; }

  public static Operator parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("operator is blank");
    return Operator.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
