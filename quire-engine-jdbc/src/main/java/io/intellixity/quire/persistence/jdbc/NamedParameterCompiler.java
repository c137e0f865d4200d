package io.intellixity.quire.persistence.jdbc;

import io.intellixity.quire.persistence.sql.SqlBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles SQL containing named parameters ({@code :name}) into JDBC SQL with {@code ?} placeholders.
 *
 * Rules:
 * - Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*
 * - '::' is a cast, not a param.
 * - Params inside single-quoted strings, double-quoted or [bracketed] identifiers and comments are ignored.
 * - A name may appear several times; its value is bound at each occurrence.
 */
public final class NamedParameterCompiler {
  private NamedParameterCompiler() {}

  /** Renders {@code builder} and resolves its placeholders against {@link SqlBuilder#parameters()}. */
  public static SqlStatement compile(SqlBuilder builder) {
    String sql = builder.toSqlString();
    if (sql.isEmpty()) throw new IllegalStateException("SqlBuilder has no SELECT clause");
    return compile(sql, builder.parameters());
  }

  public static SqlStatement compile(String sql, Map<String, Object> params) {
    if (sql == null) return new SqlStatement("", List.of());
    Map<String, Object> effective = params == null ? Map.of() : params;

    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Object> values = new ArrayList<>();
    int i = 0;
    while (i < sql.length()) {
      char ch = sql.charAt(i);

      int literalEnd = literalEnd(sql, i);
      if (literalEnd > i) {
        out.append(sql, i, literalEnd);
        i = literalEnd;
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i += 2;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          if (!effective.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
          values.add(effective.get(name));
          out.append('?');
          i = end;
          continue;
        }
      }

      out.append(ch);
      i++;
    }

    return new SqlStatement(out.toString(), values);
  }

  /**
   * End (exclusive) of the quoted text or comment starting at {@code i}, or {@code i} when none starts there.
   * Unterminated spans run to the end of the input.
   */
  private static int literalEnd(String sql, int i) {
    char ch = sql.charAt(i);
    switch (ch) {
      case '\'':
      case '"':
        return quotedEnd(sql, i, ch);
      case '[':
        return quotedEnd(sql, i, ']');
      case '-':
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
          int nl = sql.indexOf('\n', i + 2);
          return nl < 0 ? sql.length() : nl;
        }
        return i;
      case '/':
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
          int close = sql.indexOf("*/", i + 2);
          return close < 0 ? sql.length() : close + 2;
        }
        return i;
      default:
        return i;
    }
  }

  /** A doubled closing character is an escape and stays inside the span. */
  private static int quotedEnd(String sql, int open, char close) {
    int j = open + 1;
    while (j < sql.length()) {
      if (sql.charAt(j) == close) {
        if (j + 1 < sql.length() && sql.charAt(j + 1) == close) {
          j += 2;
          continue;
        }
        return j + 1;
      }
      j++;
    }
    return sql.length();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
