package io.intellixity.fetchgraph.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites SQL with named parameters ({@code :name}) into JDBC SQL with {@code ?} placeholders.
 * <p>
 * Rules:
 * <ul>
 *   <li>a parameter is {@code ':'} followed by {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>{@code ::} is a cast, not a parameter</li>
 *   <li>text inside single quotes or double-quoted identifiers is copied verbatim</li>
 * </ul>
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    scan(sql, out, null);
    return out.toString();
  }

  /** Parameter names in order of appearance; a repeated name appears once per use. */
  public static List<String> paramNames(String sql) {
    List<String> names = new ArrayList<>();
    if (sql != null) scan(sql, null, names);
    return names;
  }

  private static void scan(String sql, StringBuilder out, List<String> names) {
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (ch == quote) {
          // doubled quote is an escaped quote
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            append(out, ch);
            i++;
          } else {
            quote = 0;
          }
        }
        append(out, ch);
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        append(out, ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          append(out, "::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          if (names != null) names.add(sql.substring(start, end));
          append(out, '?');
          i = end - 1;
          continue;
        }
      }

      append(out, ch);
    }
  }

  private static void append(StringBuilder out, char ch) {
    if (out != null) out.append(ch);
  }

  private static void append(StringBuilder out, String s) {
    if (out != null) out.append(s);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
