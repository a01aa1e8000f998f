package io.intellixity.polystage.mongo;

import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** BSON document -> plain Java row (ObjectId as hex, Date as Instant, Decimal128 as BigDecimal). */
final class MongoRows {
  private MongoRows() {}

  static Map<String, Object> toRow(Document doc) {
    Map<String, Object> out = new LinkedHashMap<>(doc.size() * 2);
    for (var e : doc.entrySet()) out.put(e.getKey(), normalize(e.getValue()));
    return out;
  }

  static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Decimal128 dec) return dec.isNaN() || dec.isInfinite() ? dec.toString() : dec.bigDecimalValue();
    if (v instanceof Binary b) return b.getData();
    if (v instanceof Document d) return toRow(d);
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
}
