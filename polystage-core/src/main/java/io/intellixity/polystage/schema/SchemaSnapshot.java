package io.intellixity.polystage.schema;

import io.intellixity.polystage.model.BackendKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable structural description of one backend.\n
 *
 * Every backend shape (tables, labels/relationship types, collections) is exposed through a common
 * entity -> field -> type view for placeholder target lookups.\n
 */
public interface SchemaSnapshot {
  BackendKind backend();

  /** Entity name -> field name -> semantic type, in declaration order. */
  Map<String, Map<String, FieldType>> fieldsByEntity();

  default Optional<FieldType> fieldType(String entity, String field) {
    Map<String, FieldType> fields = fieldsByEntity().get(entity);
    if (fields == null) return Optional.empty();
    return Optional.ofNullable(fields.get(field));
  }

  /** Every entity declaring {@code field}, with the type it declares, in schema order. */
  default Map<String, FieldType> locate(String field) {
    Map<String, FieldType> out = new LinkedHashMap<>();
    for (var e : fieldsByEntity().entrySet()) {
      FieldType t = e.getValue().get(field);
      if (t != null) out.put(e.getKey(), t);
    }
    return out;
  }
}
