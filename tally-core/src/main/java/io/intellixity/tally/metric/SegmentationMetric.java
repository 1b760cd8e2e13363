package io.intellixity.tally.metric;

import io.intellixity.tally.segment.Segment;

import java.util.Objects;

/** Unique users and event counts of one segment, bucketed over time and optionally grouped. */
public record SegmentationMetric(Segment segment, MetricConfig config) implements Metric {
  public SegmentationMetric {
    Objects.requireNonNull(segment, "segment");
    if (config == null) config = MetricConfig.defaults();
  }

  public static SegmentationMetric of(Segment segment) { return new SegmentationMetric(segment, null); }

  public SegmentationMetric with(MetricConfig config) { return new SegmentationMetric(segment, config); }
}
