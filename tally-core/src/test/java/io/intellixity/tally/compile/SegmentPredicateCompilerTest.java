package io.intellixity.tally.compile;

import io.intellixity.tally.TestSchemas;
import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.error.UnsupportedFeatureException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.DiscoveredTable;
import io.intellixity.tally.segment.BinaryOperator;
import io.intellixity.tally.segment.Operator;
import io.intellixity.tally.segment.Segment;
import io.intellixity.tally.segment.SegmentModel;
import io.intellixity.tally.segment.SimpleSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SegmentPredicateCompilerTest {
  private final DiscoveredEventDataSource schema = TestSchemas.shop();
  private final SegmentModel m = new SegmentModel(schema);
  private final SegmentPredicateCompiler compiler = new SegmentPredicateCompiler(schema);

  private static final Expr PAGE_VIEW = Exprs.eq(ColumnRef.of("t1", "event_name"), new Literal("page_view"));

  private Expr compile(Segment s) {
    DiscoveredTable t = compiler.tableOf(s);
    return compiler.compile(s, t, "t1");
  }

  @Test
  void occurrenceMatchesEventNameColumn() {
    assertEquals(PAGE_VIEW, compile(m.event("page_view").occurred()));
  }

  @Test
  void aliasTableOccurrenceIsAlwaysTrue() {
    assertEquals(BoolLiteral.TRUE, compile(m.event("sign_up").occurred()));
    DiscoveredTable signups = schema.table("signups").orElseThrow();
    assertEquals(BoolLiteral.FALSE, compiler.compile(SimpleSegment.occurred("page_view"), signups, "t2"));
  }

  @Test
  void fieldComparisonIsAndedWithEventMatch() {
    Expr e = compile(m.event("page_view").field("country").eq("DE"));
    assertEquals(new Junction(BinaryOperator.AND, List.of(PAGE_VIEW,
        new Comparison(ColumnRef.of("t1", "country"), Comparison.Op.EQ, new Literal("DE")))), e);
  }

  @Test
  void aliasTableFieldComparisonDropsTheEventMatch() {
    Expr e = compile(m.event("sign_up").field("source").neq("ads"));
    assertEquals(new Comparison(ColumnRef.of("t1", "source"), Comparison.Op.NEQ, new Literal("ads")), e);
  }

  @Test
  void mapKeysWithDotsResolveThroughTheParent() {
    Junction j = (Junction) compile(m.event("purchase").field("props.a.b").eq("x"));
    Comparison c = (Comparison) j.parts().get(1);
    assertEquals(new ColumnRef("t1", "props", List.of(new ColumnRef.PathStep("a.b", true))), c.left());
  }

  @Test
  void structMembersAreNotMapLookups() {
    Junction j = (Junction) compile(m.event("purchase").field("device.os").isNull());
    assertEquals(new IsNull(new ColumnRef("t1", "device", List.of(new ColumnRef.PathStep("os", false))), false),
        j.parts().get(1));
  }

  @Test
  void listOperators() {
    Junction any = (Junction) compile(m.event("page_view").field("country").anyOf("DE", "FR"));
    assertEquals(new InList(ColumnRef.of("t1", "country"), List.of(new Literal("DE"), new Literal("FR"))),
        any.parts().get(1));

    Junction none = (Junction) compile(m.event("page_view").field("country").noneOf(List.of("DE")));
    assertEquals(new Not(new InList(ColumnRef.of("t1", "country"), List.of(new Literal("DE")))), none.parts().get(1));
  }

  @Test
  void emptyListAndMissingValueMatchEverything() {
    assertEquals(PAGE_VIEW, compile(m.event("page_view").field("country").anyOf(List.of())));
    assertEquals(PAGE_VIEW, compile(m.event("page_view").field("price").gt(null)));
  }

  @Test
  void likeAndNotLike() {
    Junction like = (Junction) compile(m.event("page_view").field("country").like("D%"));
    assertEquals(new Like(ColumnRef.of("t1", "country"), new Literal("D%")), like.parts().get(1));
    Junction notLike = (Junction) compile(m.event("page_view").field("country").notLike("D%"));
    assertEquals(new Not(new Like(ColumnRef.of("t1", "country"), new Literal("D%"))), notLike.parts().get(1));
  }

  @Test
  void complexSegmentsKeepTheirShape() {
    Segment s = m.event("page_view").occurred().or(m.event("purchase").field("price").gtEq(10));
    Junction or = (Junction) compile(s);
    assertEquals(BinaryOperator.OR, or.op());
    assertEquals(2, or.parts().size());
    assertEquals(PAGE_VIEW, or.parts().get(0));
  }

  @Test
  void compilationIsRepeatable() {
    Segment s = m.event("page_view").field("country").eq("DE").and(m.event("page_view").field("props.plan").isNotNull());
    assertEquals(compile(s), compile(s));
  }

  @Test
  void anyEventUsesTheOnlyTable() {
    SegmentPredicateCompiler single = new SegmentPredicateCompiler(TestSchemas.eventsOnly());
    Segment any = SimpleSegment.occurred("any_event");
    DiscoveredTable t = single.tableOf(any);
    assertEquals("events", t.table().id());
    assertEquals(BoolLiteral.TRUE, single.compile(any, t, "t1"));
  }

  @Test
  void anyEventIsAmbiguousAcrossTables() {
    assertThrows(UnsupportedFeatureException.class, () -> compiler.tableOf(SimpleSegment.occurred("any_event")));
  }

  @Test
  void andAcrossTablesIsRejected() {
    Segment s = m.event("page_view").occurred().and(m.event("sign_up").occurred());
    assertThrows(UnsupportedFeatureException.class, () -> compiler.tableOf(s));
    assertThrows(UnsupportedFeatureException.class, () -> compiler.split(s));
  }

  @Test
  void orAcrossTablesSplitsPerTable() {
    Segment view = m.event("page_view").field("country").eq("DE");
    Segment signUp = m.event("sign_up").occurred();
    Segment purchase = m.event("purchase").occurred();

    List<SegmentPredicateCompiler.Part> parts = compiler.split(view.or(signUp).or(purchase));

    assertEquals(2, parts.size());
    assertEquals("events", parts.get(0).table().table().id());
    assertEquals(view.or(purchase), parts.get(0).segment());
    assertEquals("signups", parts.get(1).table().table().id());
    assertEquals(signUp, parts.get(1).segment());
    assertThrows(UnsupportedFeatureException.class, () -> compiler.tableOf(view.or(signUp)));
  }

  @Test
  void sameTableOrKeepsASinglePart() {
    Segment s = m.event("page_view").occurred().or(m.event("purchase").occurred());
    List<SegmentPredicateCompiler.Part> parts = compiler.split(s);
    assertEquals(1, parts.size());
    assertEquals(s, parts.get(0).segment());
  }

  @Test
  void unknownEventsAndFieldsAreRejected() {
    assertThrows(MetricValidationException.class, () -> compiler.tableOf(SimpleSegment.occurred("nope")));
    SimpleSegment bad = SimpleSegment.of("page_view", "missing", Operator.EQ, "x");
    assertThrows(MetricValidationException.class, () -> compile(bad));
    assertThrows(MetricValidationException.class, () -> m.event("nope"));
    assertThrows(MetricValidationException.class, () -> m.event("page_view").field("source"));
  }
}
