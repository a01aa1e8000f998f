package io.intellixity.polystage.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.model.Stage;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes translator output into a {@link Plan}.\n
 *
 * <pre>\n
 * {"pipeline": [\n
 *   {"stage": 1, "database": "postgres", "query": "SELECT ...", "output_keys": ["id"]},\n
 *   {"stage": 2, "database": "mongodb", "query": {"collection": "reviews", "filter": {...}}, "output_label": "reviews"}\n
 * ]}\n
 * </pre>\n
 *
 * {@code query} may also be an object keyed by database name, e.g. {@code {"neo4j": "MATCH ..."}}.\n
 */
public final class PlanJsonReader {
  private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {};

  private PlanJsonReader() {}

  public static Plan read(String json) {
    try {
      return read(Json.mapper().readTree(json));
    } catch (JsonProcessingException e) {
      throw new InvalidPlanException("Plan is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Plan read(InputStream in) {
    try {
      return read(Json.mapper().readTree(in));
    } catch (IOException e) {
      throw new InvalidPlanException("Plan is not valid JSON: " + e.getMessage(), e);
    }
  }

  static Plan read(JsonNode root) {
    if (root == null || !root.isObject()) throw new InvalidPlanException("Plan must be a JSON object");
    JsonNode pipeline = root.get("pipeline");
    if (pipeline == null || !pipeline.isArray()) throw new InvalidPlanException("Plan has no 'pipeline' array");
    List<Stage> stages = new ArrayList<>(pipeline.size());
    int pos = 0;
    for (JsonNode n : pipeline) {
      stages.add(stage(n, ++pos));
    }
    return Plan.of(stages);
  }

  private static Stage stage(JsonNode n, int position) {
    if (!n.isObject()) throw new InvalidPlanException("pipeline[" + (position - 1) + "] is not an object");
    JsonNode idx = n.get("stage");
    int index;
    if (idx == null || idx.isNull()) {
      index = position;
    } else if (idx.canConvertToInt() && idx.isIntegralNumber()) {
      index = idx.intValue();
    } else if (idx.isTextual() && idx.asText().trim().matches("\\d+")) {
      index = Integer.parseInt(idx.asText().trim());
    } else {
      throw new InvalidPlanException("pipeline[" + (position - 1) + "].stage is not an integer: " + idx);
    }

    BackendKind backend;
    String database = text(n, "database");
    if (database == null) throw new InvalidPlanException("Stage " + index + " has no 'database'");
    try {
      backend = BackendKind.fromName(database);
    } catch (IllegalArgumentException e) {
      throw new InvalidPlanException("Stage " + index + ": " + e.getMessage(), e);
    }

    String query = query(n.get("query"), backend, index);
    Map<String, Object> params = new LinkedHashMap<>();
    JsonNode p = n.get("parameters");
    if (p != null && !p.isNull()) {
      if (!p.isObject()) throw new InvalidPlanException("Stage " + index + ": 'parameters' must be an object");
      params = Json.mapper().convertValue(p, PARAMS);
    }
    List<String> keys = new ArrayList<>();
    JsonNode k = n.get("output_keys");
    if (k != null && !k.isNull()) {
      if (!k.isArray()) throw new InvalidPlanException("Stage " + index + ": 'output_keys' must be an array");
      for (JsonNode key : k) keys.add(key.asText());
    }
    return new Stage(index, backend, query, params, text(n, "output_label"), keys, text(n, "description"));
  }

  private static String query(JsonNode q, BackendKind backend, int index) {
    if (q == null || q.isNull()) throw new InvalidPlanException("Stage " + index + " has no 'query'");
    if (q.isTextual()) return requireText(q.asText(), index);
    if (!q.isObject()) throw new InvalidPlanException("Stage " + index + ": 'query' must be a string or an object");

    // {"neo4j": "MATCH ..."} form: one entry naming the database
    if (q.size() == 1) {
      Iterator<Map.Entry<String, JsonNode>> it = q.fields();
      Map.Entry<String, JsonNode> only = it.next();
      if (isBackendName(only.getKey(), backend)) return query(only.getValue(), backend, index);
    }
    if (backend != BackendKind.DOCUMENT) {
      throw new InvalidPlanException("Stage " + index + ": object query is only valid for mongodb");
    }
    try {
      return Json.mapper().writeValueAsString(q);
    } catch (JsonProcessingException e) {
      throw new InvalidPlanException("Stage " + index + ": cannot encode query", e);
    }
  }

  private static boolean isBackendName(String name, BackendKind expected) {
    try {
      return BackendKind.fromName(name) == expected;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  private static String requireText(String s, int index) {
    if (s.isBlank()) throw new InvalidPlanException("Stage " + index + " has an empty query");
    return s;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return null;
    String s = v.asText();
    return s.isBlank() ? null : s;
  }
}
