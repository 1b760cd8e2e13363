package io.intellixity.tally.error;

/** Wraps a driver failure together with the SQL that was sent. */
public class QueryExecutionException extends TallyException {
  private final String sql;

  public QueryExecutionException(String message, String sql) {
    super(message);
    this.sql = sql;
  }

  public QueryExecutionException(String message, String sql, Throwable cause) {
    super(message, cause);
    this.sql = sql;
  }

  /** Rendered SQL of the failing statement, or null when no statement was issued. */
  public String sql() { return sql; }
}
