package io.intellixity.tally.segment;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.EventDef;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Fluent segment builder checked against a schema snapshot at call time:\n
 *
 * <pre>
 * SegmentModel m = new SegmentModel(snapshot);
 * Segment s = m.event("page_view").field("country").eq("DE").or(m.event("signup").occurred());
 * </pre>
 *
 * Unknown events or field paths fail immediately with {@link MetricValidationException}.\n
 */
public final class SegmentModel {
  private final DiscoveredEventDataSource schema;

  public SegmentModel(DiscoveredEventDataSource schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public EventSelector event(String eventName) {
    Objects.requireNonNull(eventName, "eventName");
    if (!EventDef.ANY_EVENT.equals(eventName) && schema.event(eventName).isEmpty()) {
      throw new MetricValidationException("Unknown event '" + eventName + "' in source " + schema.sourceId());
    }
    return new EventSelector(eventName);
  }

  public EventSelector anyEvent() { return event(EventDef.ANY_EVENT); }

  public final class EventSelector {
    private final String eventName;

    private EventSelector(String eventName) { this.eventName = eventName; }

    public Segment occurred() { return SimpleSegment.occurred(eventName); }

    public FieldSelector field(String path) {
      Objects.requireNonNull(path, "path");
      if (schema.field(eventName, path).isEmpty()) {
        throw new MetricValidationException("Unknown field '" + path + "' for event '" + eventName + "'");
      }
      return new FieldSelector(eventName, path);
    }
  }

  public static final class FieldSelector {
    private final String eventName;
    private final String path;

    private FieldSelector(String eventName, String path) {
      this.eventName = eventName;
      this.path = path;
    }

    public EventFieldRef ref() { return new EventFieldRef(eventName, path); }

    public Segment eq(Object v) { return op(Operator.EQ, v); }
    public Segment neq(Object v) { return op(Operator.NEQ, v); }
    public Segment gt(Object v) { return op(Operator.GT, v); }
    public Segment lt(Object v) { return op(Operator.LT, v); }
    public Segment gtEq(Object v) { return op(Operator.GT_EQ, v); }
    public Segment ltEq(Object v) { return op(Operator.LT_EQ, v); }
    public Segment like(String pattern) { return op(Operator.LIKE, pattern); }
    public Segment notLike(String pattern) { return op(Operator.NOT_LIKE, pattern); }
    public Segment anyOf(Object... values) { return op(Operator.ANY_OF, Arrays.asList(values)); }
    public Segment anyOf(Collection<?> values) { return op(Operator.ANY_OF, values); }
    public Segment noneOf(Object... values) { return op(Operator.NONE_OF, Arrays.asList(values)); }
    public Segment noneOf(Collection<?> values) { return op(Operator.NONE_OF, values); }
    public Segment isNull() { return op(Operator.IS_NULL, null); }
    public Segment isNotNull() { return op(Operator.IS_NOT_NULL, null); }

    private Segment op(Operator op, Object right) { return new SimpleSegment(eventName, path, op, right); }
  }
}
