package io.intellixity.tally.error;

public final class QueryCancelledException extends QueryExecutionException {
  public QueryCancelledException(String message, String sql) { super(message, sql); }
  public QueryCancelledException(String message, String sql, Throwable cause) { super(message, sql, cause); }
}
