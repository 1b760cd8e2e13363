package io.intellixity.tally.compile;

/** Output column names of compiled metric queries. */
public final class MetricColumns {
  public static final String DATETIME = "datetime";
  public static final String GROUP = "group";
  public static final String UNIQUE_USER_COUNT = "unique_user_count";
  public static final String EVENT_COUNT = "event_count";
  public static final String CONVERSION_RATE = "conversion_rate";

  private MetricColumns() {}

  public static String uniqueUserCount(int step) { return UNIQUE_USER_COUNT + "_" + step; }

  public static String eventCount(int step) { return EVENT_COUNT + "_" + step; }
}
