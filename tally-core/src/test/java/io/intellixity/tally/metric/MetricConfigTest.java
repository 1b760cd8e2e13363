package io.intellixity.tally.metric;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

final class MetricConfigTest {
  private static final LocalDateTime JAN_1 = LocalDateTime.of(2023, 1, 1, 0, 0);

  @Test
  void defaults() {
    MetricConfig c = MetricConfig.defaults();
    assertEquals(TimeWindow.THIRTY_DAYS, c.lookback());
    assertEquals(TimeGroup.DAY, c.timeGroup());
    assertEquals(MetricConfig.DEFAULT_MAX_GROUP_COUNT, c.maxGroupCount());
    assertNull(c.startDt());
    assertNull(c.endDt());
  }

  @Test
  void emptyRangeIsAValidationError() {
    MetricConfig c = MetricConfig.defaults();
    assertThrows(MetricValidationException.class, () -> c.between(JAN_1, JAN_1));
    assertThrows(MetricValidationException.class, () -> c.between(JAN_1.plusDays(1), JAN_1));
    assertEquals(JAN_1, c.between(JAN_1, null).startDt());
  }
}
