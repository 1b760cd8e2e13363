package io.intellixity.tally.jdbc;

import io.intellixity.tally.compile.MetricColumns;
import io.intellixity.tally.compile.QueryPlan;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.util.CancellationToken;

import java.util.Objects;

/**
 * A metric compiled for one source. The statement is rendered once; {@link #render()} and
 * {@link #execute()} both derive from it.
 */
public final class CompiledMetricQuery {
  private final Metric metric;
  private final QueryPlan plan;
  private final SqlStatement statement;
  private final JdbcEventAdapter adapter;

  CompiledMetricQuery(Metric metric, QueryPlan plan, SqlStatement statement, JdbcEventAdapter adapter) {
    this.metric = Objects.requireNonNull(metric, "metric");
    this.plan = Objects.requireNonNull(plan, "plan");
    this.statement = Objects.requireNonNull(statement, "statement");
    this.adapter = Objects.requireNonNull(adapter, "adapter");
  }

  public Metric metric() { return metric; }
  public QueryPlan plan() { return plan; }
  public SqlStatement statement() { return statement; }

  /** SQL with bound values inlined, for display. */
  public String render() { return NamedParams.inline(statement.sql(), statement.values()); }

  public ResultTable execute() { return execute(CancellationToken.create()); }

  /**
   * Runs the statement. {@code datetime} is decoded to {@link java.time.LocalDateTime},
   * counts to {@code Long} and {@code conversion_rate} to {@code Double}.
   */
  public ResultTable execute(CancellationToken cancellation) {
    ResultTable raw = adapter.execute(statement, cancellation);
    ResultTable out = raw.mapColumn(MetricColumns.DATETIME, v -> adapter.dialect().decodeDateTime(v));
    for (String col : raw.columns()) {
      if (col.equalsIgnoreCase(MetricColumns.CONVERSION_RATE)) {
        out = out.mapColumn(col, CompiledMetricQuery::toDouble);
      } else if (col.startsWith(MetricColumns.UNIQUE_USER_COUNT) || col.startsWith(MetricColumns.EVENT_COUNT)) {
        out = out.mapColumn(col, CompiledMetricQuery::toLong);
      }
    }
    return out;
  }

  private static Object toDouble(Object v) {
    if (v == null) return null;
    return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
  }

  private static Object toLong(Object v) {
    if (v == null) return null;
    return v instanceof Number n ? n.longValue() : Long.parseLong(v.toString());
  }

  @Override
  public String toString() { return "CompiledMetricQuery[" + plan.kind() + "] " + statement.sql(); }
}
