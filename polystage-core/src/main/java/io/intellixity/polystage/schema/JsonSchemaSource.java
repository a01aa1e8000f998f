package io.intellixity.polystage.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polystage.error.SchemaUnavailableException;
import io.intellixity.polystage.model.BackendKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the schema-inference JSON document.\n
 *
 * Expected top-level keys: {@code postgres}, {@code neo4j}, {@code mongodb} (any subset).\n
 *
 * <pre>\n
 * "postgres": { "movies": [["id", "integer"], ["title", "text"]] }        // or {"id": "integer"}\n
 * "neo4j":    { "nodes": { "('Person',)": ["name", "born"] },             // or {"name": "STRING"}\n
 *               "relationships": { "ACTED_IN": ["roles"] } }\n
 * "mongodb":  { "reviews": { "movie_id": "int", "author": { "name": "string" } } }\n
 * </pre>\n
 *
 * When backed by a file, every {@link #introspect} re-reads it so a registry reload picks up a new dump.\n
 */
public final class JsonSchemaSource implements SchemaSource {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final Path file;
  private final JsonNode inline;

  private JsonSchemaSource(Path file, JsonNode inline) {
    this.file = file;
    this.inline = inline;
  }

  public static JsonSchemaSource fromFile(Path file) {
    return new JsonSchemaSource(Objects.requireNonNull(file, "file"), null);
  }

  public static JsonSchemaSource fromJson(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return new JsonSchemaSource(null, JSON.readTree(json));
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid schema JSON", e);
    }
  }

  @Override
  public SchemaSnapshot introspect(BackendKind backend) {
    JsonNode root = root(backend);
    JsonNode node = root.get(backend.schemaKey());
    if (node == null || node.isNull()) {
      throw new SchemaUnavailableException(backend, "no '" + backend.schemaKey() + "' section");
    }
    if (!node.isObject()) {
      throw new SchemaUnavailableException(backend, "'" + backend.schemaKey() + "' section is not an object");
    }
    return switch (backend) {
      case RELATIONAL -> parseRelational(node);
      case GRAPH -> parseGraph(node);
      case DOCUMENT -> parseDocument(node);
    };
  }

  @Override
  public Set<BackendKind> available() {
    JsonNode root;
    try {
      root = readRoot();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read schema file " + file, e);
    }
    Set<BackendKind> out = EnumSet.noneOf(BackendKind.class);
    for (BackendKind k : BackendKind.values()) {
      JsonNode n = root.get(k.schemaKey());
      if (n != null && n.isObject()) out.add(k);
    }
    return out;
  }

  private JsonNode root(BackendKind backend) {
    try {
      JsonNode root = readRoot();
      if (!root.isObject()) throw new SchemaUnavailableException(backend, "schema document is not an object");
      return root;
    } catch (IOException e) {
      throw new SchemaUnavailableException(backend, "cannot read " + file, e);
    }
  }

  private JsonNode readRoot() throws IOException {
    if (inline != null) return inline;
    return JSON.readTree(Files.readAllBytes(file));
  }

  static RelationalSchema parseRelational(JsonNode node) {
    Map<String, List<RelationalSchema.Column>> tables = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      var e = it.next();
      List<RelationalSchema.Column> cols = new ArrayList<>();
      for (var f : typedFields(e.getValue()).entrySet()) {
        String declared = f.getValue();
        cols.add(new RelationalSchema.Column(f.getKey(), declared, FieldType.parse(BackendKind.RELATIONAL, declared)));
      }
      tables.put(e.getKey(), cols);
    }
    return new RelationalSchema(tables);
  }

  static GraphSchema parseGraph(JsonNode node) {
    Map<List<String>, Map<String, FieldType>> nodes = new LinkedHashMap<>();
    JsonNode n = node.get("nodes");
    if (n != null && n.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = n.fields(); it.hasNext(); ) {
        var e = it.next();
        List<String> labels = parseLabels(e.getKey());
        if (labels.isEmpty()) continue;
        nodes.put(labels, types(BackendKind.GRAPH, typedFields(e.getValue())));
      }
    }
    Map<String, Map<String, FieldType>> rels = new LinkedHashMap<>();
    JsonNode r = node.get("relationships");
    if (r != null && r.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = r.fields(); it.hasNext(); ) {
        var e = it.next();
        rels.put(e.getKey(), types(BackendKind.GRAPH, typedFields(e.getValue())));
      }
    }
    return new GraphSchema(nodes, rels);
  }

  static DocumentSchema parseDocument(JsonNode node) {
    Map<String, Map<String, FieldType>> collections = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      var e = it.next();
      Map<String, FieldType> fields = new LinkedHashMap<>();
      flattenDocument("", e.getValue(), fields);
      collections.put(e.getKey(), fields);
    }
    return new DocumentSchema(collections);
  }

  private static void flattenDocument(String prefix, JsonNode node, Map<String, FieldType> out) {
    if (node.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
        var e = it.next();
        String path = prefix + e.getKey();
        JsonNode v = e.getValue();
        if (v.isObject()) {
          out.put(path, FieldType.JSON);
          flattenDocument(path + ".", v, out);
        } else if (v.isArray()) {
          out.put(path, FieldType.JSON);
        } else {
          out.put(path, FieldType.parse(BackendKind.DOCUMENT, v.isNull() ? null : v.asText()));
        }
      }
    } else if (node.isArray()) {
      for (var e : typedFields(node).entrySet()) {
        out.put(prefix + e.getKey(), FieldType.parse(BackendKind.DOCUMENT, e.getValue()));
      }
    }
  }

  /**
   * Accepts {@code {"f": "type"}}, {@code [["f", "type"], ...]}, {@code ["f", ...]} and
   * {@code [{"name": "f", "type": "t"}, ...]}; untyped fields map to null.
   */
  private static Map<String, String> typedFields(JsonNode node) {
    Map<String, String> out = new LinkedHashMap<>();
    if (node == null || node.isNull()) return out;
    if (node.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
        var e = it.next();
        JsonNode v = e.getValue();
        out.put(e.getKey(), v.isValueNode() && !v.isNull() ? v.asText() : null);
      }
      return out;
    }
    if (node.isArray()) {
      for (JsonNode item : node) {
        if (item.isTextual()) {
          out.put(item.asText(), null);
        } else if (item.isArray() && item.size() >= 1) {
          out.put(item.get(0).asText(), item.size() > 1 && !item.get(1).isNull() ? item.get(1).asText() : null);
        } else if (item.isObject() && item.hasNonNull("name")) {
          JsonNode t = item.get("type");
          out.put(item.get("name").asText(), t == null || t.isNull() ? null : t.asText());
        }
      }
    }
    return out;
  }

  private static Map<String, FieldType> types(BackendKind backend, Map<String, String> declared) {
    Map<String, FieldType> out = new LinkedHashMap<>();
    for (var e : declared.entrySet()) out.put(e.getKey(), FieldType.parse(backend, e.getValue()));
    return out;
  }

  /** "('Person', 'Actor')", "('Movie',)", "Person:Actor" or "Movie". */
  static List<String> parseLabels(String key) {
    String k = key.trim();
    if (k.startsWith("(") && k.endsWith(")")) k = k.substring(1, k.length() - 1);
    if (k.startsWith("[") && k.endsWith("]")) k = k.substring(1, k.length() - 1);
    String[] parts = k.contains(",") ? k.split(",") : k.split(":");
    List<String> labels = new ArrayList<>();
    for (String p : parts) {
      String l = p.trim();
      if (l.length() >= 2 && (l.charAt(0) == '\'' || l.charAt(0) == '"') && l.charAt(l.length() - 1) == l.charAt(0)) {
        l = l.substring(1, l.length() - 1);
      }
      if (!l.isEmpty()) labels.add(l);
    }
    return labels;
  }
}
