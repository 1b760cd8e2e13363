package io.intellixity.tally.metric;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.tally.serde.MetricJsonDeserializer;
import io.intellixity.tally.serde.MetricJsonSerializer;

/** A complete analytics question: {@link SegmentationMetric} or {@link ConversionMetric}. */
@JsonSerialize(using = MetricJsonSerializer.class)
@JsonDeserialize(using = MetricJsonDeserializer.class)
public interface Metric {
  MetricConfig config();
}
