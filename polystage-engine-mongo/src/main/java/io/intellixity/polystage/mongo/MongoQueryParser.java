package io.intellixity.polystage.mongo;

import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the JSON query spec used by document stages.\n
 *
 * <pre>\n
 * {"collection": "reviews", "filter": {...}, "projection": {...}, "sort": {...}, "skip": 0, "limit": 10}\n
 * {"collection": "reviews", "pipeline": [{"$match": {...}}, ...]}\n
 * </pre>\n
 *
 * Parameters are referenced anywhere in the spec as {@code {"$param": "name"}} and replaced by the bound
 * value after parsing, so values never pass through JSON text.\n
 */
public final class MongoQueryParser {
  public static final String PARAM_KEY = "$param";
  private static final Set<String> KNOWN = Set.of("collection", "filter", "projection", "sort", "skip", "limit", "pipeline");

  private MongoQueryParser() {}

  public static MongoStatement parse(String json, Map<String, Object> params) {
    Document spec;
    try {
      spec = Document.parse(json);
    } catch (JsonParseException | BsonInvalidOperationException e) {
      throw new IllegalArgumentException("Invalid Mongo query spec: " + e.getMessage(), e);
    }
    for (String key : spec.keySet()) {
      if (!KNOWN.contains(key)) throw new IllegalArgumentException("Unknown Mongo query spec key: " + key);
    }
    Object collection = spec.get("collection");
    if (!(collection instanceof String c) || c.isBlank()) {
      throw new IllegalArgumentException("Mongo query spec needs a 'collection' string");
    }
    Map<String, Object> p = (params == null) ? Map.of() : params;

    if (spec.containsKey("pipeline")) {
      Object raw = substitute(spec.get("pipeline"), p);
      if (!(raw instanceof List<?> stages)) throw new IllegalArgumentException("'pipeline' must be an array");
      List<Document> pipeline = new ArrayList<>(stages.size());
      for (Object s : stages) {
        if (!(s instanceof Document d)) throw new IllegalArgumentException("pipeline stages must be objects");
        pipeline.add(d);
      }
      return MongoStatement.aggregate(c, pipeline);
    }

    return MongoStatement.find(c,
        document(spec, "filter", p),
        document(spec, "projection", p),
        document(spec, "sort", p),
        integer(spec, "skip", p),
        integer(spec, "limit", p));
  }

  private static Document document(Document spec, String key, Map<String, Object> params) {
    Object v = spec.get(key);
    if (v == null) return null;
    Object sub = substitute(v, params);
    if (!(sub instanceof Document d)) throw new IllegalArgumentException("'" + key + "' must be an object");
    return d;
  }

  private static Integer integer(Document spec, String key, Map<String, Object> params) {
    Object v = substitute(spec.get(key), params);
    if (v == null) return null;
    if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()) && n.longValue() >= 0
        && n.longValue() <= Integer.MAX_VALUE) {
      return n.intValue();
    }
    throw new IllegalArgumentException("'" + key + "' must be a non-negative integer");
  }

  /** Replace {"$param": name} markers, recursively. */
  static Object substitute(Object node, Map<String, Object> params) {
    if (node instanceof Document d) {
      if (d.size() == 1 && d.containsKey(PARAM_KEY)) {
        Object name = d.get(PARAM_KEY);
        if (!(name instanceof String n)) throw new IllegalArgumentException("$param must name a parameter");
        if (!params.containsKey(n)) throw new IllegalArgumentException("Missing query param: " + n);
        return params.get(n);
      }
      Document out = new Document();
      for (var e : d.entrySet()) out.put(e.getKey(), substitute(e.getValue(), params));
      return out;
    }
    if (node instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(substitute(o, params));
      return out;
    }
    return node;
  }
}
