package io.intellixity.tally.segment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/**
 * "Event occurred" ({@code operator == null}) or "event occurred with field op value".\n
 * {@code right} is a scalar, or a list for ANY_OF/NONE_OF, and is dropped for null tests.\n
 */
public final class SimpleSegment implements Segment {
  private final String eventName;
  private final String fieldPath;
  private final Operator operator;
  private final Object right;

  public SimpleSegment(String eventName, String fieldPath, Operator operator, Object right) {
    this.eventName = Objects.requireNonNull(eventName, "eventName");
    if (operator != null && fieldPath == null) {
      throw new IllegalArgumentException("operator " + operator + " requires a field for event " + eventName);
    }
    this.fieldPath = fieldPath;
    this.operator = operator;
    this.right = normalizeRight(operator, right);
  }

  public static SimpleSegment occurred(String eventName) { return new SimpleSegment(eventName, null, null, null); }

  public static SimpleSegment of(String eventName, String fieldPath, Operator operator, Object right) {
    return new SimpleSegment(eventName, fieldPath, operator, right);
  }

  public String eventName() { return eventName; }
  public String fieldPath() { return fieldPath; }
  public Operator operator() { return operator; }
  public Object right() { return right; }

  private static Object normalizeRight(Operator op, Object right) {
    if (op == null || op.ignoresRight() || right == null) return null;
    if (op.takesList()) {
      if (right instanceof Collection<?> c) return Collections.unmodifiableList(new ArrayList<>(c));
      if (right instanceof Object[] arr) return Collections.unmodifiableList(new ArrayList<>(java.util.Arrays.asList(arr)));
      return Collections.singletonList(right);
    }
    if (right instanceof Collection<?>) throw new IllegalArgumentException(op + " expects a single value, got a list");
    return right;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SimpleSegment s)) return false;
    return eventName.equals(s.eventName) && Objects.equals(fieldPath, s.fieldPath)
        && operator == s.operator && Objects.equals(right, s.right);
  }

  @Override
  public int hashCode() { return Objects.hash(eventName, fieldPath, operator, right); }

  @Override
  public String toString() {
    if (operator == null) return eventName;
    return eventName + "." + fieldPath + " " + operator + (right == null ? "" : " " + right);
  }
}
