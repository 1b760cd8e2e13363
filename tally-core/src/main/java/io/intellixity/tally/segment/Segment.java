package io.intellixity.tally.segment;

/** Boolean condition over event occurrences: a {@link SimpleSegment} or a {@link ComplexSegment}. */
public interface Segment {
  default Segment and(Segment other) { return new ComplexSegment(this, BinaryOperator.AND, other); }

  default Segment or(Segment other) { return new ComplexSegment(this, BinaryOperator.OR, other); }
}
