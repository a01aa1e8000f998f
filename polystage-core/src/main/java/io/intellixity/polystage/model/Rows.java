package io.intellixity.polystage.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Deep, null-tolerant unmodifiable copies of result rows; nested maps, lists and sets included. */
final class Rows {
  private Rows() {}

  static List<Map<String, Object>> freeze(List<Map<String, Object>> rows) {
    List<Map<String, Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (Map<String, Object> r : rows) copy.add(freezeRow(r));
    }
    return Collections.unmodifiableList(copy);
  }

  static Map<String, Object> freezeRow(Map<String, Object> row) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (var e : row.entrySet()) copy.put(e.getKey(), freezeValue(e.getValue()));
    return Collections.unmodifiableMap(copy);
  }

  private static Object freezeValue(Object v) {
    if (v instanceof Map<?, ?> m) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (var e : m.entrySet()) copy.put(e.getKey(), freezeValue(e.getValue()));
      return Collections.unmodifiableMap(copy);
    }
    if (v instanceof Set<?> s) {
      Set<Object> copy = new LinkedHashSet<>();
      for (Object o : s) copy.add(freezeValue(o));
      return Collections.unmodifiableSet(copy);
    }
    if (v instanceof Collection<?> c) {
      List<Object> copy = new ArrayList<>(c.size());
      for (Object o : c) copy.add(freezeValue(o));
      return Collections.unmodifiableList(copy);
    }
    return v;
  }
}
