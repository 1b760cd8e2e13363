package io.intellixity.tally.serde;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.tally.metric.ConversionMetric;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.metric.MetricConfig;
import io.intellixity.tally.metric.SegmentationMetric;
import io.intellixity.tally.segment.ComplexSegment;
import io.intellixity.tally.segment.Segment;
import io.intellixity.tally.segment.SimpleSegment;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Locale;

/**
 * Compact JSON form of a {@link Metric}. Fields are referenced by event name and path only;
 * absent values are never written.
 */
public final class MetricJsonSerializer extends JsonSerializer<Metric> {
  @Override
  public void serialize(Metric m, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (m == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (m instanceof SegmentationMetric s) {
      g.writeFieldName(MetricTags.SEGMENT);
      writeSegment(s.segment(), g, serializers);
    } else if (m instanceof ConversionMetric c) {
      g.writeObjectFieldStart(MetricTags.CONVERSION);
      g.writeArrayFieldStart(MetricTags.SEGMENTS);
      for (Segment step : c.steps()) writeSegment(step, g, serializers);
      g.writeEndArray();
      g.writeEndObject();
      g.writeStringField(MetricTags.CONV_WINDOW, c.convWindow().toString());
    } else {
      throw new IllegalArgumentException("Unknown metric type: " + m.getClass().getName());
    }
    writeConfig(m.config(), g);
    g.writeEndObject();
  }

  private static void writeConfig(MetricConfig c, JsonGenerator g) throws IOException {
    g.writeObjectFieldStart(MetricTags.CONFIG);
    if (c.startDt() != null) g.writeStringField(MetricTags.START_DT, MetricTags.formatDateTime(c.startDt()));
    if (c.endDt() != null) g.writeStringField(MetricTags.END_DT, MetricTags.formatDateTime(c.endDt()));
    g.writeStringField(MetricTags.LOOKBACK, c.lookback().toString());
    g.writeStringField(MetricTags.TIME_GROUP, c.timeGroup().name().toLowerCase(Locale.ROOT));
    g.writeNumberField(MetricTags.MAX_GROUP_COUNT, c.maxGroupCount());
    if (c.groupBy() != null) {
      g.writeObjectFieldStart(MetricTags.GROUP_BY);
      g.writeStringField(MetricTags.EVENT_NAME, c.groupBy().eventName());
      g.writeStringField(MetricTags.FIELD, c.groupBy().fieldPath());
      g.writeEndObject();
    }
    if (c.customTitle() != null) g.writeStringField(MetricTags.CUSTOM_TITLE, c.customTitle());
    g.writeEndObject();
  }

  private static void writeSegment(Segment s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s instanceof ComplexSegment c) {
      g.writeStartObject();
      g.writeFieldName(MetricTags.LEFT);
      writeSegment(c.left(), g, serializers);
      g.writeStringField(MetricTags.BINARY_OP, c.operator().name());
      g.writeFieldName(MetricTags.RIGHT);
      writeSegment(c.right(), g, serializers);
      g.writeEndObject();
      return;
    }
    SimpleSegment ss = (SimpleSegment) s;
    g.writeStartObject();
    g.writeObjectFieldStart(MetricTags.LEFT);
    g.writeStringField(MetricTags.EVENT_NAME, ss.eventName());
    if (ss.fieldPath() != null) g.writeStringField(MetricTags.FIELD, ss.fieldPath());
    g.writeEndObject();
    if (ss.operator() != null) g.writeStringField(MetricTags.OPERATOR, ss.operator().name());
    if (ss.right() != null) {
      g.writeFieldName(MetricTags.RIGHT);
      writeValue(ss.right(), g, serializers);
    }
    g.writeEndObject();
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof LocalDateTime t) {
      g.writeString(MetricTags.formatDateTime(t));
      return;
    }
    if (v instanceof Collection<?> c) {
      g.writeStartArray();
      for (Object x : c) writeValue(x, g, serializers);
      g.writeEndArray();
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
