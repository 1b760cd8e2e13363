package io.intellixity.tally.jdbc;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Rewrites named parameters ({@code :name}) into JDBC {@code ?} placeholders.\n
 *
 * Rules:\n
 * - a parameter is ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a cast, not a parameter\n
 * - text inside single quotes or double-quoted identifiers is left untouched\n
 */
public final class NamedParams {
  private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private NamedParams() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' escape inside a literal
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }
    return out.toString();
  }

  /**
   * Display form of a rendered statement: {@code :bN} placeholders replaced by the literal text of
   * the N-th value. Not meant to be executed.
   */
  public static String inline(String sql, List<Object> values) {
    StringBuilder out = new StringBuilder(sql.length() + 32);
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (ch == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
      else if (ch == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
      else if (ch == ':' && !inSingleQuote && !inDoubleQuote
          && i + 1 < sql.length() && sql.charAt(i + 1) == 'b') {
        int end = i + 2;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        if (end > i + 2 && (end == sql.length() || !isIdentPart(sql.charAt(end)))) {
          int idx = Integer.parseInt(sql.substring(i + 2, end)) - 1;
          if (idx >= 0 && idx < values.size()) {
            out.append(literal(values.get(idx)));
            i = end - 1;
            continue;
          }
        }
      }
      out.append(ch);
    }
    return out.toString();
  }

  private static String literal(Object v) {
    if (v == null) return "NULL";
    if (v instanceof Number || v instanceof Boolean) return v.toString();
    if (v instanceof Timestamp ts) return "'" + TS.format(ts.toLocalDateTime()) + "'";
    if (v instanceof LocalDateTime t) return "'" + TS.format(t) + "'";
    return "'" + v.toString().replace("'", "''") + "'";
  }

  /** Number of placeholders {@link #toJdbcSql} would produce. */
  public static int count(String sql) {
    String jdbc = toJdbcSql(sql);
    int n = 0;
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (ch == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
      else if (ch == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
      else if (ch == '?' && !inSingleQuote && !inDoubleQuote) n++;
    }
    return n;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
