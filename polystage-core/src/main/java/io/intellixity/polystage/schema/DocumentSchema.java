package io.intellixity.polystage.schema;

import io.intellixity.polystage.model.BackendKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Collections with their declared field types (dot paths allowed as field names). */
public final class DocumentSchema implements SchemaSnapshot {
  private final Map<String, Map<String, FieldType>> collections;

  public DocumentSchema(Map<String, Map<String, FieldType>> collections) {
    Objects.requireNonNull(collections, "collections");
    Map<String, Map<String, FieldType>> c = new LinkedHashMap<>();
    for (var e : collections.entrySet()) {
      c.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
    }
    this.collections = Collections.unmodifiableMap(c);
  }

  @Override public BackendKind backend() { return BackendKind.DOCUMENT; }
  @Override public Map<String, Map<String, FieldType>> fieldsByEntity() { return collections; }

  public Map<String, Map<String, FieldType>> collections() { return collections; }
}
