package io.intellixity.tally.compile;

import io.intellixity.tally.expr.Expr;
import io.intellixity.tally.model.DateRange;
import io.intellixity.tally.model.EventDataTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dialect-neutral compiled metric query: select list, base table, left joins, filter and
 * grouping (1-based select positions). Dialects render it; it is never re-derived from the metric.
 */
public record QueryPlan(Kind kind,
                        List<SelectItem> select,
                        TableRef from,
                        List<Join> joins,
                        Expr where,
                        List<Integer> groupBy,
                        DateRange range) {
  public enum Kind { SEGMENTATION, CONVERSION }

  public static final String USER_ID = "_user_id";
  public static final String EVENT_TIME = "_event_time";
  public static final String GROUP = "_group";

  public record SelectItem(Expr expr, String alias) {
    public SelectItem {
      Objects.requireNonNull(expr, "expr");
      Objects.requireNonNull(alias, "alias");
    }
  }

  /**
   * A plain table, or a derived relation made of {@link Branch}es combined with UNION ALL. A union
   * exposes the columns {@link #USER_ID}, {@link #EVENT_TIME} and {@link #GROUP}.
   */
  public record TableRef(EventDataTable table, String alias, List<Branch> union) {
    public TableRef {
      Objects.requireNonNull(alias, "alias");
      union = union == null ? List.of() : List.copyOf(union);
      if ((table == null) == union.isEmpty()) {
        throw new IllegalArgumentException("a table ref is either a table or a non-empty union");
      }
    }

    public TableRef(EventDataTable table, String alias) {
      this(Objects.requireNonNull(table, "table"), alias, List.of());
    }

    public static TableRef union(List<Branch> branches, String alias) {
      return new TableRef(null, alias, branches);
    }

    public boolean isUnion() { return !union.isEmpty(); }
  }

  /** One table of a union: its rows matching {@code where}, projected to user, time and group. */
  public record Branch(EventDataTable table, String alias, Expr where, Expr group) {
    public Branch {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(alias, "alias");
      Objects.requireNonNull(where, "where");
      Objects.requireNonNull(group, "group");
    }
  }

  public record Join(TableRef table, Expr on) {
    public Join {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(on, "on");
    }
  }

  public QueryPlan {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(range, "range");
    select = List.copyOf(select);
    joins = joins == null ? List.of() : List.copyOf(joins);
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    if (select.isEmpty()) throw new IllegalArgumentException("select list is empty");
    for (int pos : groupBy) {
      if (pos < 1 || pos > select.size()) throw new IllegalArgumentException("group by position out of range: " + pos);
    }
  }

  public List<String> columns() {
    List<String> out = new ArrayList<>(select.size());
    for (SelectItem s : select) out.add(s.alias());
    return out;
  }
}
