package io.intellixity.polystage.mapping;

import java.util.Map;

/**
 * Dot-path access into result rows.\n
 *
 * A key containing the literal dots wins over nested traversal ("a.b" column vs {"a": {"b": ..}}).\n
 */
public final class FieldPaths {
  private FieldPaths() {}

  public static boolean has(Map<String, Object> row, String path) {
    if (row == null) return false;
    if (row.containsKey(path)) return true;
    Object cur = row;
    for (String part : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(part)) return false;
      cur = m.get(part);
    }
    return true;
  }

  public static Object get(Map<String, Object> row, String path) {
    if (row == null) return null;
    if (row.containsKey(path)) return row.get(path);
    Object cur = row;
    for (String part : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(part);
    }
    return cur;
  }
}
