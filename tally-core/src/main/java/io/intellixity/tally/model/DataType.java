package io.intellixity.tally.model;

/** Semantic column type, independent of any warehouse's native type names. */
public enum DataType {
  STRING,
  NUMBER,
  BOOL,
  DATETIME,
  MAP,
  STRUCT,
  ARRAY;

  public boolean isComplex() { return this == MAP || this == STRUCT; }
}
