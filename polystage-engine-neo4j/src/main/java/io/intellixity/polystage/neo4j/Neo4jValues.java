package io.intellixity.polystage.neo4j;

import io.intellixity.polystage.schema.FieldType;
import org.neo4j.driver.Record;
import org.neo4j.driver.types.Entity;
import org.neo4j.driver.types.IsoDuration;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Point;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Conversions between driver values and plain Java values.\n
 *
 * Reading: nodes and relationships become their property maps, paths the list of their nodes,
 * date-times Instants. Writing: UUID -> String, BigDecimal -> Double, Instant -> ZonedDateTime (UTC).\n
 */
final class Neo4jValues {
  private Neo4jValues() {}

  static Map<String, Object> toRow(Record record) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String key : record.keys()) out.put(key, normalize(record.get(key).asObject()));
    return out;
  }

  static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof Entity e) return normalize(e.asMap());
    if (v instanceof Path p) {
      List<Object> nodes = new ArrayList<>();
      for (Node n : p.nodes()) nodes.add(normalize(n));
      return nodes;
    }
    if (v instanceof ZonedDateTime z) return z.toInstant();
    if (v instanceof OffsetDateTime o) return o.toInstant();
    if (v instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC);
    if (v instanceof IsoDuration || v instanceof Point) return v.toString();
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(normalize(o));
      return out;
    }
    return v;
  }

  static Object toNative(Object value, FieldType targetType) {
    if (value instanceof UUID u) return u.toString();
    if (value instanceof BigDecimal bd) return bd.doubleValue();
    if (value instanceof Instant i) return ZonedDateTime.ofInstant(i, ZoneOffset.UTC);
    return value;
  }
}
