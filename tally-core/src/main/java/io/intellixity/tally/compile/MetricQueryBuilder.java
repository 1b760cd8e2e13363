package io.intellixity.tally.compile;

import io.intellixity.tally.error.MetricValidationException;
import io.intellixity.tally.expr.*;
import io.intellixity.tally.metric.ConversionMetric;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.metric.MetricConfig;
import io.intellixity.tally.metric.SegmentationMetric;
import io.intellixity.tally.model.DateRange;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.model.DiscoveredTable;
import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.TimeGroup;
import io.intellixity.tally.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a {@link Metric} into a {@link QueryPlan} against one schema snapshot.\n
 *
 * Segmentation: one aliased table filtered by the segment and the time range.\n
 * Conversion: step 1 is the base table ({@code t1}); every later step {@code ti} is the step's table
 * LEFT JOINed on the same user, a strictly later time no further than the conversion window after
 * step i-1, and the step predicate. Bucket and group always come from {@code t1}.\n
 * A segment that ORs events of several tables reads a UNION ALL of per-table selects instead.\n
 */
public final class MetricQueryBuilder {
  private static final Logger log = LoggerFactory.getLogger(MetricQueryBuilder.class);

  private final DiscoveredEventDataSource schema;
  private final SegmentPredicateCompiler predicates;
  private final FieldResolver fields = new FieldResolver();
  private final Clock clock;

  public MetricQueryBuilder(DiscoveredEventDataSource schema) {
    this(schema, Clock.systemDefaultZone());
  }

  public MetricQueryBuilder(DiscoveredEventDataSource schema, Clock clock) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.predicates = new SegmentPredicateCompiler(schema);
  }

  public QueryPlan build(Metric metric) {
    Objects.requireNonNull(metric, "metric");
    if (metric instanceof SegmentationMetric s) return segmentation(s);
    if (metric instanceof ConversionMetric c) return conversion(c);
    throw new MetricValidationException("Unknown metric type: " + metric.getClass().getName());
  }

  public DateRange range(MetricConfig config) {
    LocalDateTime end = config.endDt() != null
        ? config.endDt()
        : LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    LocalDateTime start = config.startDt() != null ? config.startDt() : config.lookback().subtractFrom(end);
    if (!start.isBefore(end)) {
      throw new MetricValidationException("Metric time range is empty: " + start + " / " + end);
    }
    return new DateRange(start, end);
  }

  private QueryPlan segmentation(SegmentationMetric m) {
    MetricConfig cfg = m.config();
    DateRange range = range(cfg);
    String alias = stepAlias(1);
    Source src = source(m.segment(), alias, cfg);

    List<QueryPlan.SelectItem> select = new ArrayList<>();
    select.add(new QueryPlan.SelectItem(bucket(cfg.timeGroup(), src.time()), MetricColumns.DATETIME));
    select.add(new QueryPlan.SelectItem(src.group(), MetricColumns.GROUP));
    select.add(new QueryPlan.SelectItem(new Count(src.user(), true), MetricColumns.UNIQUE_USER_COUNT));
    select.add(new QueryPlan.SelectItem(new Count(src.user(), false), MetricColumns.EVENT_COUNT));

    Expr where = Exprs.and(src.predicate(), timeFilter(src.time(), range));
    log.debug("tally.compile op=SEGMENTATION source={} from={} timeGroup={} range={}",
        schema.sourceId(), src.describe(), cfg.timeGroup(), range);
    return new QueryPlan(QueryPlan.Kind.SEGMENTATION, select, src.ref(), List.of(), where, List.of(1, 2), range);
  }

  private QueryPlan conversion(ConversionMetric m) {
    MetricConfig cfg = m.config();
    DateRange range = range(cfg);
    List<Segment> steps = m.steps();

    List<Source> sources = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size(); i++) {
      sources.add(source(steps.get(i), stepAlias(i + 1), i == 0 ? cfg : null));
    }
    Source first = sources.get(0);

    List<QueryPlan.Join> joins = new ArrayList<>();
    for (int i = 1; i < steps.size(); i++) {
      Source prev = sources.get(i - 1);
      Source cur = sources.get(i);
      Expr on = Exprs.and(
          Exprs.eq(cur.user(), prev.user()),
          Exprs.gt(cur.time(), prev.time()),
          Exprs.ltEq(cur.time(), new AddInterval(prev.time(), m.convWindow())),
          cur.predicate());
      joins.add(new QueryPlan.Join(cur.ref(), on));
    }

    int n = steps.size();
    List<QueryPlan.SelectItem> select = new ArrayList<>();
    select.add(new QueryPlan.SelectItem(bucket(cfg.timeGroup(), first.time()), MetricColumns.DATETIME));
    select.add(new QueryPlan.SelectItem(first.group(), MetricColumns.GROUP));
    select.add(new QueryPlan.SelectItem(new Ratio(
        new Count(sources.get(n - 1).user(), true),
        new Count(first.user(), true)), MetricColumns.CONVERSION_RATE));
    for (int i = 1; i <= n; i++) {
      ColumnRef user = sources.get(i - 1).user();
      select.add(new QueryPlan.SelectItem(new Count(user, true), MetricColumns.uniqueUserCount(i)));
      select.add(new QueryPlan.SelectItem(new Count(user, false), MetricColumns.eventCount(i)));
    }

    Expr where = Exprs.and(first.predicate(), timeFilter(first.time(), range));
    log.debug("tally.compile op=CONVERSION source={} steps={} window={} timeGroup={} range={}",
        schema.sourceId(), n, m.convWindow(), cfg.timeGroup(), range);
    return new QueryPlan(QueryPlan.Kind.CONVERSION, select, first.ref(), joins, where, List.of(1, 2), range);
  }

  /**
   * What one segment reads from. A single-table segment reads its table under {@code alias} and
   * filters it with {@code predicate}; a segment spanning tables reads a union whose branches carry
   * the per-table predicates.
   */
  private record Source(QueryPlan.TableRef ref, ColumnRef user, ColumnRef time, Expr predicate, Expr group) {
    String describe() {
      if (!ref.isUnion()) return ref.table().id();
      List<String> ids = new ArrayList<>();
      for (QueryPlan.Branch b : ref.union()) ids.add(b.table().id());
      return "union" + ids;
    }
  }

  /** {@code groupCfg} is null for steps that do not carry the group. */
  private Source source(Segment segment, String alias, MetricConfig groupCfg) {
    List<SegmentPredicateCompiler.Part> parts = predicates.split(segment);
    if (parts.size() == 1) {
      DiscoveredTable table = parts.get(0).table();
      EventDataTable t = table.table();
      return new Source(new QueryPlan.TableRef(t, alias),
          ColumnRef.of(alias, t.userIdField()), ColumnRef.of(alias, t.eventTimeField()),
          predicates.compile(parts.get(0).segment(), table, alias), group(groupCfg, table, alias));
    }
    List<QueryPlan.Branch> branches = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      SegmentPredicateCompiler.Part p = parts.get(i);
      String branchAlias = alias + "_" + (i + 1);
      branches.add(new QueryPlan.Branch(p.table().table(), branchAlias,
          predicates.compile(p.segment(), p.table(), branchAlias), group(groupCfg, p.table(), branchAlias)));
    }
    Expr group = groupCfg == null || groupCfg.groupBy() == null
        ? Literal.NULL
        : ColumnRef.of(alias, QueryPlan.GROUP);
    return new Source(QueryPlan.TableRef.union(branches, alias),
        ColumnRef.of(alias, QueryPlan.USER_ID), ColumnRef.of(alias, QueryPlan.EVENT_TIME), BoolLiteral.TRUE, group);
  }

  private static Expr bucket(TimeGroup tg, ColumnRef time) {
    if (tg == TimeGroup.TOTAL) return Literal.NULL;
    return new DateTrunc(tg, time);
  }

  /** The group-by field is read from the given (step 1) table; a field it lacks groups as NULL. */
  private Expr group(MetricConfig cfg, DiscoveredTable table, String alias) {
    if (cfg == null || cfg.groupBy() == null) return Literal.NULL;
    return fields.column(table, alias, cfg.groupBy().fieldPath()).<Expr>map(c -> c).orElse(Literal.NULL);
  }

  private static Expr timeFilter(ColumnRef time, DateRange range) {
    return Exprs.and(Exprs.gtEq(time, new Literal(range.start())), Exprs.lt(time, new Literal(range.end())));
  }

  static String stepAlias(int step) { return "t" + step; }
}
