package io.intellixity.tally.serde;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Short keys of the metric JSON form. */
final class MetricTags {
  static final String SEGMENT = "seg";
  static final String CONVERSION = "conv";
  static final String SEGMENTS = "segs";
  static final String CONV_WINDOW = "cw";
  static final String CONFIG = "co";

  static final String START_DT = "sdt";
  static final String END_DT = "edt";
  static final String LOOKBACK = "lbd";
  static final String TIME_GROUP = "tg";
  static final String MAX_GROUP_COUNT = "mgc";
  static final String GROUP_BY = "gb";
  static final String CUSTOM_TITLE = "ct";

  static final String LEFT = "l";
  static final String RIGHT = "r";
  static final String OPERATOR = "op";
  static final String BINARY_OP = "bop";
  static final String EVENT_NAME = "en";
  static final String FIELD = "f";

  private MetricTags() {}

  static String formatDateTime(LocalDateTime t) { return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(t); }
}
