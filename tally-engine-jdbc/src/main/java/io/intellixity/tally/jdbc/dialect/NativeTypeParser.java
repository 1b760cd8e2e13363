package io.intellixity.tally.jdbc.dialect;

import io.intellixity.tally.error.TypeMappingException;
import io.intellixity.tally.model.DataType;
import io.intellixity.tally.model.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Parses native column type strings as reported by JDBC metadata.\n
 *
 * Understands both the angle-bracket family ({@code struct<a:int,b:string>}, {@code map<string,int>},
 * {@code array<string>}) and the parenthesized one ({@code row(a integer, b varchar)},
 * {@code map(varchar, bigint)}, {@code array(varchar)}). Anything else is a scalar, resolved by
 * the dialect's mapper.\n
 */
final class NativeTypeParser {
  private final Function<String, DataType> scalars;

  NativeTypeParser(Function<String, DataType> scalars) {
    this.scalars = scalars;
  }

  Field parse(String name, String nativeType) {
    if (nativeType == null || nativeType.isBlank()) throw new TypeMappingException("Column " + name + " has no type");
    String s = nativeType.trim();
    String lower = s.toLowerCase(Locale.ROOT);

    String inner;
    if ((inner = unwrap(s, lower, "struct")) != null) return Field.struct(name, members(inner, ':'));
    if ((inner = unwrap(s, lower, "row")) != null) return Field.struct(name, members(inner, ' '));
    if ((inner = unwrap(s, lower, "map")) != null) {
      int comma = findTopComma(inner);
      if (comma < 0) throw new TypeMappingException("map type requires key and value: " + nativeType);
      return Field.map(name, typeOf(inner.substring(comma + 1)), List.of());
    }
    if ((inner = unwrap(s, lower, "array")) != null) return Field.array(name, typeOf(inner));
    return Field.of(name, scalars.apply(s));
  }

  private DataType typeOf(String nativeType) {
    return parse("_", nativeType).type();
  }

  private List<Field> members(String inner, char separator) {
    List<Field> out = new ArrayList<>();
    for (String part : splitTop(inner)) {
      String p = part.trim();
      if (p.isEmpty()) continue;
      int sep = separator == ' ' ? firstWhitespace(p) : p.indexOf(separator);
      if (sep < 0) throw new TypeMappingException("Malformed struct member: " + p);
      String memberName = unquote(p.substring(0, sep).trim());
      out.add(parse(memberName, p.substring(sep + 1).trim()));
    }
    return out;
  }

  private static String unwrap(String s, String lower, String keyword) {
    if (!lower.startsWith(keyword)) return null;
    String rest = s.substring(keyword.length()).trim();
    if (rest.length() < 2) return null;
    char open = rest.charAt(0);
    char close = rest.charAt(rest.length() - 1);
    if ((open == '<' && close == '>') || (open == '(' && close == ')')) return rest.substring(1, rest.length() - 1);
    return null;
  }

  private static List<String> splitTop(String s) {
    List<String> out = new ArrayList<>();
    String rest = s;
    int comma;
    while ((comma = findTopComma(rest)) >= 0) {
      out.add(rest.substring(0, comma));
      rest = rest.substring(comma + 1);
    }
    out.add(rest);
    return out;
  }

  private static int findTopComma(String s) {
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '<' || c == '(') depth++;
      else if (c == '>' || c == ')') depth--;
      else if (c == ',' && depth == 0) return i;
    }
    return -1;
  }

  private static int firstWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }

  private static String unquote(String s) {
    if (s.length() >= 2) {
      char f = s.charAt(0);
      char l = s.charAt(s.length() - 1);
      if ((f == '"' && l == '"') || (f == '`' && l == '`')) return s.substring(1, s.length() - 1);
    }
    return s;
  }
}
