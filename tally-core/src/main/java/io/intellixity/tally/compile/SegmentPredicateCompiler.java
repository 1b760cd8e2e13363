package io.intellixity.tally.compile;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.DiscoveredTable;
import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.EventDef;
import io.intellixity.tally.segment.BinaryOperator;
import io.intellixity.tally.segment.ComplexSegment;
import io.intellixity.tally.segment.Operator;
import io.intellixity.tally.segment.Segment;
import io.intellixity.tally.segment.SimpleSegment;

import java.util.*;

/**
 * Compiles a {@link Segment} tree into a predicate {@link Expr} over one aliased table.\n
 *
 * The result carries no SQL, so the same predicate serves a WHERE clause or a join condition.\n
 * Compilation is pure: repeated calls on the same input produce equal trees.\n
 */
public final class SegmentPredicateCompiler {
  private final DiscoveredEventDataSource schema;
  private final FieldResolver fields = new FieldResolver();

  public SegmentPredicateCompiler(DiscoveredEventDataSource schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** A segment, or the part of one, whose events all live in {@code table}. */
  public record Part(DiscoveredTable table, Segment segment) {
    public Part {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(segment, "segment");
    }
  }

  /** The single table every event of {@code segment} lives in. */
  public DiscoveredTable tableOf(Segment segment) {
    List<Part> parts = split(segment);
    if (parts.size() > 1) {
      throw new UnsupportedFeatureException("Segment spans several tables " + tableIds(parts)
          + "; combine events of one table per segment");
    }
    return parts.get(0).table();
  }

  /**
   * Splits {@code segment} by table. Parts of an OR that live in the same table are merged back
   * into one OR; an OR across tables yields one part per table, in first-seen order. An AND must
   * stay within one table since it is evaluated against a single row.
   */
  public List<Part> split(Segment segment) {
    Objects.requireNonNull(segment, "segment");
    if (segment instanceof SimpleSegment s) return List.of(new Part(tableOfSimple(s), s));
    if (segment instanceof ComplexSegment c) {
      List<Part> l = split(c.left());
      List<Part> r = split(c.right());
      if (c.operator() == BinaryOperator.AND) {
        if (l.size() != 1 || r.size() != 1 || !sameTable(l.get(0), r.get(0))) {
          List<Part> all = new ArrayList<>(l);
          all.addAll(r);
          throw new UnsupportedFeatureException("AND between events of different tables " + tableIds(all)
              + " never matches; use AND within one table or OR across tables");
        }
        return List.of(new Part(l.get(0).table(), c));
      }
      LinkedHashMap<String, Part> merged = new LinkedHashMap<>();
      for (List<Part> side : List.of(l, r)) {
        for (Part p : side) {
          merged.merge(p.table().table().id(), p,
              (a, b) -> new Part(a.table(), new ComplexSegment(a.segment(), BinaryOperator.OR, b.segment())));
        }
      }
      return List.copyOf(merged.values());
    }
    throw new IllegalArgumentException("Unknown segment type: " + segment.getClass().getName());
  }

  private DiscoveredTable tableOfSimple(SimpleSegment s) {
    if (EventDef.ANY_EVENT.equals(s.eventName())) {
      List<DiscoveredTable> all = schema.tables();
      if (all.size() != 1) {
        throw new UnsupportedFeatureException("'" + EventDef.ANY_EVENT + "' is ambiguous across "
            + all.size() + " tables of source " + schema.sourceId());
      }
      return all.get(0);
    }
    List<DiscoveredTable> candidates = schema.tablesFor(s.eventName());
    if (candidates.isEmpty()) {
      throw new MetricValidationException("Unknown event '" + s.eventName() + "' in source " + schema.sourceId());
    }
    return candidates.get(0);
  }

  private static boolean sameTable(Part a, Part b) {
    return a.table().table().id().equals(b.table().table().id());
  }

  private static List<String> tableIds(List<Part> parts) {
    List<String> ids = new ArrayList<>();
    for (Part p : parts) {
      if (!ids.contains(p.table().table().id())) ids.add(p.table().table().id());
    }
    return ids;
  }

  public Expr compile(Segment segment, DiscoveredTable table, String alias) {
    Objects.requireNonNull(segment, "segment");
    if (segment instanceof SimpleSegment s) return compileSimple(s, table, alias);
    if (segment instanceof ComplexSegment c) {
      Expr l = compile(c.left(), table, alias);
      Expr r = compile(c.right(), table, alias);
      return new Junction(c.operator(), List.of(l, r));
    }
    throw new IllegalArgumentException("Unknown segment type: " + segment.getClass().getName());
  }

  private Expr compileSimple(SimpleSegment s, DiscoveredTable table, String alias) {
    Expr event = eventNameMatch(s.eventName(), table.table(), alias);
    if (s.operator() == null) return event;

    ColumnRef col = fields.column(table, alias, s.fieldPath()).orElseThrow(() -> new MetricValidationException(
        "Unknown field '" + s.fieldPath() + "' for event '" + s.eventName() + "' in table " + table.table().id()));
    return Exprs.and(event, leaf(s.operator(), col, s.right()));
  }

  private static Expr eventNameMatch(String eventName, EventDataTable table, String alias) {
    if (EventDef.ANY_EVENT.equals(eventName)) return BoolLiteral.TRUE;
    if (table.hasEventNameAlias()) return BoolLiteral.of(table.eventNameAlias().equals(eventName));
    return Exprs.eq(ColumnRef.of(alias, table.eventNameField()), new Literal(eventName));
  }

  private static Expr leaf(Operator op, ColumnRef col, Object right) {
    if (op == Operator.IS_NULL) return new IsNull(col, false);
    if (op == Operator.IS_NOT_NULL) return new IsNull(col, true);
    if (right == null) return BoolLiteral.TRUE;

    return switch (op) {
      case EQ -> new Comparison(col, Comparison.Op.EQ, new Literal(right));
      case NEQ -> new Comparison(col, Comparison.Op.NEQ, new Literal(right));
      case GT -> new Comparison(col, Comparison.Op.GT, new Literal(right));
      case LT -> new Comparison(col, Comparison.Op.LT, new Literal(right));
      case GT_EQ -> new Comparison(col, Comparison.Op.GT_EQ, new Literal(right));
      case LT_EQ -> new Comparison(col, Comparison.Op.LT_EQ, new Literal(right));
      case LIKE -> new Like(col, new Literal(right));
      case NOT_LIKE -> new Not(new Like(col, new Literal(right)));
      case ANY_OF -> inList(col, (List<?>) right, false);
      case NONE_OF -> inList(col, (List<?>) right, true);
      case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException("handled above");
    };
  }

  private static Expr inList(ColumnRef col, List<?> values, boolean negated) {
    if (values.isEmpty()) return BoolLiteral.TRUE;
    List<Expr> lits = new ArrayList<>(values.size());
    for (Object v : values) lits.add(Exprs.value(v));
    Expr in = new InList(col, lits);
    return negated ? new Not(in) : in;
  }
}
