package io.intellixity.polystage.jdbc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles SQL containing named parameters (e.g. :movieId) into JDBC SQL with '?' binds.\n
 *
 * Rules:\n
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single-quoted literals or double-quoted identifiers are ignored.\n
 * - A Collection value expands to one '?' per element ("IN (:ids)" -> "IN (?, ?, ?)"); an empty
 *   collection renders NULL so "IN (NULL)" matches nothing.\n
 */
public final class NamedSqlCompiler {
  private NamedSqlCompiler() {}

  public static SqlStatement compile(String sql, Map<String, Object> params) {
    if (sql == null) return new SqlStatement("", List.of());
    Map<String, Object> effective = (params == null) ? Map.of() : params;

    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Object> binds = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // '' and "" escapes
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          appendBind(out, binds, getRequired(effective, name));
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return new SqlStatement(out.toString(), binds);
  }

  private static void appendBind(StringBuilder out, List<Object> binds, Object value) {
    if (value instanceof Collection<?> c) {
      if (c.isEmpty()) {
        out.append("NULL");
        return;
      }
      boolean first = true;
      for (Object v : c) {
        if (!first) out.append(", ");
        out.append('?');
        binds.add(v);
        first = false;
      }
      return;
    }
    out.append('?');
    binds.add(value);
  }

  private static Object getRequired(Map<String, Object> params, String name) {
    if (params.containsKey(name)) return params.get(name);
    throw new IllegalArgumentException("Missing query param: " + name);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
