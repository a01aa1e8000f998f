package io.intellixity.polystage.schema;

import io.intellixity.polystage.model.BackendKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node label tuples and relationship types with their properties.\n
 *
 * A label tuple is addressable by each of its labels, so {@code Person.name} finds a property declared
 * on {@code (Person, Actor)}. Properties inferred without a type are {@link FieldType#ANY}.\n
 */
public final class GraphSchema implements SchemaSnapshot {
  private final Map<List<String>, Map<String, FieldType>> nodes;
  private final Map<String, Map<String, FieldType>> relationships;
  private final Map<String, Map<String, FieldType>> fields;

  public GraphSchema(Map<List<String>, Map<String, FieldType>> nodes,
                     Map<String, Map<String, FieldType>> relationships) {
    Map<List<String>, Map<String, FieldType>> n = new LinkedHashMap<>();
    Map<String, Map<String, FieldType>> f = new LinkedHashMap<>();
    if (nodes != null) {
      for (var e : nodes.entrySet()) {
        Map<String, FieldType> props = Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue()));
        n.put(List.copyOf(e.getKey()), props);
        for (String label : e.getKey()) merge(f, label, props);
      }
    }
    Map<String, Map<String, FieldType>> r = new LinkedHashMap<>();
    if (relationships != null) {
      for (var e : relationships.entrySet()) {
        Map<String, FieldType> props = Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue()));
        r.put(Objects.requireNonNull(e.getKey(), "relationship type"), props);
        merge(f, e.getKey(), props);
      }
    }
    this.nodes = Collections.unmodifiableMap(n);
    this.relationships = Collections.unmodifiableMap(r);
    f.replaceAll((k, v) -> Collections.unmodifiableMap(v));
    this.fields = Collections.unmodifiableMap(f);
  }

  private static void merge(Map<String, Map<String, FieldType>> into, String entity, Map<String, FieldType> props) {
    Map<String, FieldType> cur = into.computeIfAbsent(entity, k -> new LinkedHashMap<>());
    for (var p : props.entrySet()) {
      // A typed declaration wins over an untyped one for the same label.
      cur.merge(p.getKey(), p.getValue(), (a, b) -> a == FieldType.ANY ? b : a);
    }
  }

  @Override public BackendKind backend() { return BackendKind.GRAPH; }
  @Override public Map<String, Map<String, FieldType>> fieldsByEntity() { return fields; }

  public Map<List<String>, Map<String, FieldType>> nodes() { return nodes; }

  public Map<String, Map<String, FieldType>> relationships() { return relationships; }
}
