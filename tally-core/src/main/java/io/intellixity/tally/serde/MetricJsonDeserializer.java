package io.intellixity.tally.serde;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.error.SerializationException;
import io.intellixity.tally.metric.ConversionMetric;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.metric.MetricConfig;
import io.intellixity.tally.metric.SegmentationMetric;
import io.intellixity.tally.model.DataType;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.EventDef;
import io.intellixity.tally.model.Field;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.model.TimeWindow;
import io.intellixity.tally.segment.*;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the compact metric form, re-resolving every event and field path against the schema
 * snapshot attached under {@link MetricCodec#SCHEMA_ATTRIBUTE}.
 */
public final class MetricJsonDeserializer extends JsonDeserializer<Metric> {
  @Override
  public Metric deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    Object attr = ctxt.getAttribute(MetricCodec.SCHEMA_ATTRIBUTE);
    if (!(attr instanceof DiscoveredEventDataSource schema)) {
      throw new SerializationException("No schema snapshot attached to metric deserialization");
    }
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || !root.isObject()) throw new SerializationException("Metric JSON must be an object");

    boolean seg = root.has(MetricTags.SEGMENT);
    boolean conv = root.has(MetricTags.CONVERSION);
    if (seg == conv) {
      throw new SerializationException("Metric JSON must carry exactly one of '" + MetricTags.SEGMENT
          + "' or '" + MetricTags.CONVERSION + "'");
    }

    MetricConfig config = readConfig(root.get(MetricTags.CONFIG), schema);
    if (seg) return new SegmentationMetric(readSegment(root.get(MetricTags.SEGMENT), schema), config);

    JsonNode c = root.get(MetricTags.CONVERSION);
    JsonNode segs = c == null ? null : c.get(MetricTags.SEGMENTS);
    if (segs == null || !segs.isArray() || segs.isEmpty()) {
      throw new SerializationException("Conversion metric requires a non-empty '" + MetricTags.SEGMENTS + "' array");
    }
    List<Segment> steps = new ArrayList<>();
    for (JsonNode s : segs) steps.add(readSegment(s, schema));
    TimeWindow cw = root.has(MetricTags.CONV_WINDOW)
        ? parse(root.get(MetricTags.CONV_WINDOW).asText(), TimeWindow::parse, "conversion window")
        : null;
    return new ConversionMetric(steps, cw, config);
  }

  private static Segment readSegment(JsonNode n, DiscoveredEventDataSource schema) {
    if (n == null || !n.isObject()) throw new SerializationException("Segment must be an object: " + n);
    if (n.has(MetricTags.BINARY_OP)) {
      BinaryOperator op = parse(n.get(MetricTags.BINARY_OP).asText(), BinaryOperator::parse, "binary operator");
      return new ComplexSegment(readSegment(n.get(MetricTags.LEFT), schema), op, readSegment(n.get(MetricTags.RIGHT), schema));
    }

    JsonNode left = n.get(MetricTags.LEFT);
    String eventName = text(left == null ? null : left.get(MetricTags.EVENT_NAME));
    if (eventName == null) throw new SerializationException("Segment is missing the event name: " + n);
    if (!EventDef.ANY_EVENT.equals(eventName) && schema.event(eventName).isEmpty()) {
      throw new SerializationException("Event '" + eventName + "' not found in source " + schema.sourceId());
    }
    String path = text(left.get(MetricTags.FIELD));
    Field field = null;
    if (path != null) {
      field = schema.field(eventName, path).orElseThrow(() -> new SerializationException(
          "Field path '" + path + "' not found for event '" + eventName + "' in source " + schema.sourceId()));
    }
    String opText = text(n.get(MetricTags.OPERATOR));
    Operator op = opText == null ? null : parse(opText, Operator::parse, "operator");
    if (op != null && field == null) throw new SerializationException("Operator " + op + " requires a field: " + n);
    Object right = decodeValue(n.get(MetricTags.RIGHT), field == null ? null : field.type());
    return new SimpleSegment(eventName, path, op, right);
  }

  private static MetricConfig readConfig(JsonNode co, DiscoveredEventDataSource schema) {
    if (co == null || co.isNull()) return MetricConfig.defaults();
    if (!co.isObject()) throw new SerializationException("'" + MetricTags.CONFIG + "' must be an object");
    LocalDateTime start = dateTime(text(co.get(MetricTags.START_DT)));
    LocalDateTime end = dateTime(text(co.get(MetricTags.END_DT)));
    String lbd = text(co.get(MetricTags.LOOKBACK));
    TimeWindow lookback = lbd == null ? null : parse(lbd, TimeWindow::parse, "lookback window");
    String tg = text(co.get(MetricTags.TIME_GROUP));
    TimeGroup timeGroup = tg == null ? null : parse(tg, TimeGroup::parse, "time group");
    JsonNode mgc = co.get(MetricTags.MAX_GROUP_COUNT);
    int maxGroupCount = mgc == null || mgc.isNull() ? 0 : mgc.asInt();

    EventFieldRef groupBy = null;
    JsonNode gb = co.get(MetricTags.GROUP_BY);
    if (gb != null && !gb.isNull()) {
      String en = text(gb.get(MetricTags.EVENT_NAME));
      String f = text(gb.get(MetricTags.FIELD));
      if (en == null || f == null) throw new SerializationException("Group by requires event name and field: " + gb);
      if (schema.field(en, f).isEmpty()) {
        throw new SerializationException("Group by field path '" + f + "' not found for event '" + en + "'");
      }
      groupBy = new EventFieldRef(en, f);
    }
    try {
      return new MetricConfig(start, end, lookback, timeGroup, maxGroupCount, groupBy, text(co.get(MetricTags.CUSTOM_TITLE)));
    } catch (MetricValidationException e) {
      throw new SerializationException("Invalid metric config: " + e.getMessage(), e);
    }
  }

  private static Object decodeValue(JsonNode v, DataType type) {
    if (v == null || v.isNull()) return null;
    if (v.isArray()) {
      List<Object> out = new ArrayList<>();
      for (JsonNode x : v) out.add(decodeValue(x, type));
      return out;
    }
    if (v.isBoolean()) return v.booleanValue();
    if (v.isNumber()) return v.numberValue();
    if (v.isTextual()) return type == DataType.DATETIME ? dateTime(v.asText()) : v.asText();
    throw new SerializationException("Unsupported segment value: " + v);
  }

  private static LocalDateTime dateTime(String s) {
    if (s == null) return null;
    try {
      return LocalDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new SerializationException("Invalid datetime '" + s + "'", e);
    }
  }

  private static <T> T parse(String s, Function<String, T> parser, String what) {
    try {
      return parser.apply(s);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Unknown " + what + " '" + s + "'", e);
    }
  }

  private static String text(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
