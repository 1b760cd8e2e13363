package io.intellixity.tally.metric;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.model.TimeWindow;
import io.intellixity.tally.segment.EventFieldRef;

import java.time.LocalDateTime;

/**
 * Shared parameters of every metric.\n
 *
 * When {@code startDt} is absent the window starts {@code lookback} before the end; when
 * {@code endDt} is absent the query builder's clock supplies it.\n
 */
public record MetricConfig(LocalDateTime startDt,
                           LocalDateTime endDt,
                           TimeWindow lookback,
                           TimeGroup timeGroup,
                           int maxGroupCount,
                           EventFieldRef groupBy,
                           String customTitle) {
  public static final int DEFAULT_MAX_GROUP_COUNT = 10;

  public MetricConfig {
    if (lookback == null) lookback = TimeWindow.THIRTY_DAYS;
    if (timeGroup == null) timeGroup = TimeGroup.DAY;
    if (maxGroupCount <= 0) maxGroupCount = DEFAULT_MAX_GROUP_COUNT;
    if (startDt != null && endDt != null && !startDt.isBefore(endDt)) {
      throw new MetricValidationException("startDt must be before endDt: " + startDt + " / " + endDt);
    }
  }

  public static MetricConfig defaults() {
    return new MetricConfig(null, null, null, null, 0, null, null);
  }

  public MetricConfig between(LocalDateTime start, LocalDateTime end) {
    return new MetricConfig(start, end, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }

  public MetricConfig withLookback(TimeWindow lookback) {
    return new MetricConfig(startDt, endDt, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }

  public MetricConfig withTimeGroup(TimeGroup timeGroup) {
    return new MetricConfig(startDt, endDt, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }

  public MetricConfig withMaxGroupCount(int maxGroupCount) {
    return new MetricConfig(startDt, endDt, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }

  public MetricConfig groupedBy(EventFieldRef groupBy) {
    return new MetricConfig(startDt, endDt, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }

  public MetricConfig withTitle(String customTitle) {
    return new MetricConfig(startDt, endDt, lookback, timeGroup, maxGroupCount, groupBy, customTitle);
  }
}
