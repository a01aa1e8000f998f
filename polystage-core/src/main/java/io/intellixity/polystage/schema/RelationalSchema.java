package io.intellixity.polystage.schema;

import io.intellixity.polystage.model.BackendKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Tables with their ordered columns. */
public final class RelationalSchema implements SchemaSnapshot {
  public record Column(String name, String declaredType, FieldType type) {
    public Column {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
    }
  }

  private final Map<String, List<Column>> tables;
  private final Map<String, Map<String, FieldType>> fields;

  public RelationalSchema(Map<String, List<Column>> tables) {
    Objects.requireNonNull(tables, "tables");
    Map<String, List<Column>> t = new LinkedHashMap<>();
    Map<String, Map<String, FieldType>> f = new LinkedHashMap<>();
    for (var e : tables.entrySet()) {
      List<Column> cols = List.copyOf(e.getValue());
      t.put(e.getKey(), cols);
      Map<String, FieldType> byName = new LinkedHashMap<>();
      for (Column c : cols) byName.put(c.name(), c.type());
      f.put(e.getKey(), Collections.unmodifiableMap(byName));
    }
    this.tables = Collections.unmodifiableMap(t);
    this.fields = Collections.unmodifiableMap(f);
  }

  @Override public BackendKind backend() { return BackendKind.RELATIONAL; }
  @Override public Map<String, Map<String, FieldType>> fieldsByEntity() { return fields; }

  public Map<String, List<Column>> tables() { return tables; }
}
