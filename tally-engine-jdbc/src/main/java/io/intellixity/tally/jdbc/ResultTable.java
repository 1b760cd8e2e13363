package io.intellixity.tally.jdbc;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;
import java.util.function.Function;

/** Materialized query result: column labels plus rows of plain Java values. */
public final class ResultTable {
  private final List<String> columns;
  private final List<List<Object>> rows;
  private final Map<String, Integer> colIndex;

  public ResultTable(List<String> columns, List<List<Object>> rows) {
    this.columns = List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      if (r.size() != this.columns.size()) {
        throw new IllegalArgumentException("row has " + r.size() + " values, expected " + this.columns.size());
      }
      copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
    }
    this.rows = Collections.unmodifiableList(copy);
    Map<String, Integer> idx = new HashMap<>();
    for (int i = 0; i < this.columns.size(); i++) idx.putIfAbsent(this.columns.get(i).toLowerCase(Locale.ROOT), i);
    this.colIndex = idx;
  }

  /** Reads every row; SQL arrays are copied out while the result set is still open. */
  public static ResultTable read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> cols = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) cols.add(md.getColumnLabel(i));
    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) {
        Object v = rs.getObject(i);
        if (v instanceof Array a) {
          Object arr = a.getArray();
          v = (arr instanceof Object[] oa) ? new ArrayList<>(Arrays.asList(oa)) : arr;
          a.free();
        }
        row.add(v);
      }
      rows.add(row);
    }
    return new ResultTable(cols, rows);
  }

  public List<String> columns() { return columns; }
  public List<List<Object>> rows() { return rows; }
  public int size() { return rows.size(); }
  public boolean isEmpty() { return rows.isEmpty(); }

  public int indexOf(String column) {
    Integer i = colIndex.get(column.toLowerCase(Locale.ROOT));
    if (i == null) throw new IllegalArgumentException("Unknown result column: " + column + " (have " + columns + ")");
    return i;
  }

  public boolean hasColumn(String column) { return colIndex.containsKey(column.toLowerCase(Locale.ROOT)); }

  public Object get(int row, String column) { return rows.get(row).get(indexOf(column)); }

  public List<Object> column(String column) {
    int idx = indexOf(column);
    List<Object> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) out.add(r.get(idx));
    return out;
  }

  /** Copy with {@code fn} applied to every value of {@code column}. */
  public ResultTable mapColumn(String column, Function<Object, Object> fn) {
    int idx = indexOf(column);
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      List<Object> copy = new ArrayList<>(r);
      copy.set(idx, fn.apply(r.get(idx)));
      out.add(copy);
    }
    return new ResultTable(columns, out);
  }

  public List<Map<String, Object>> asMaps() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) m.put(columns.get(i), r.get(i));
      out.add(m);
    }
    return out;
  }

  @Override
  public String toString() { return "ResultTable" + columns + " rows=" + rows.size(); }
}
