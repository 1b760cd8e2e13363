package io.intellixity.tally.metric;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.model.TimeWindow;
import io.intellixity.tally.segment.Segment;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Ordered funnel: each step must follow the previous one by the same user within {@code convWindow}. */
public record ConversionMetric(List<Segment> steps, TimeWindow convWindow, MetricConfig config) implements Metric {
  public ConversionMetric {
    if (steps == null || steps.isEmpty()) throw new MetricValidationException("conversion metric requires at least one step");
    for (Segment s : steps) Objects.requireNonNull(s, "step");
    steps = List.copyOf(steps);
    if (convWindow == null) convWindow = TimeWindow.ONE_DAY;
    if (config == null) config = MetricConfig.defaults();
  }

  public static ConversionMetric of(Segment... steps) {
    return new ConversionMetric(Arrays.asList(steps), null, null);
  }

  public ConversionMetric within(TimeWindow convWindow) { return new ConversionMetric(steps, convWindow, config); }

  public ConversionMetric with(MetricConfig config) { return new ConversionMetric(steps, convWindow, config); }
}
