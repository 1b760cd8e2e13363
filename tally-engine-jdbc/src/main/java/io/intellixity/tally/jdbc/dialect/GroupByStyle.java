package io.intellixity.tally.jdbc.dialect;

/** How a dialect refers to grouped select items. */
public enum GroupByStyle {
  /** {@code GROUP BY 1, 2} */
  ORDINAL,
  /** {@code GROUP BY "datetime", "group"} for engines that reject column positions. */
  NAMED
}
