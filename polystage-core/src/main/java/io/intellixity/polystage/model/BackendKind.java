package io.intellixity.polystage.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Backend families a pipeline stage can target.\n
 *
 * {@link #schemaKey()} is the top-level key used by schema inference output.\n
 */
public enum BackendKind {
  RELATIONAL("postgres", List.of("postgresql", "sql", "relational")),
  GRAPH("neo4j", List.of("graph", "cypher")),
  DOCUMENT("mongodb", List.of("mongo", "document"));

  private final String schemaKey;
  private final List<String> aliases;

  BackendKind(String schemaKey, List<String> aliases) {
    this.schemaKey = schemaKey;
    this.aliases = aliases;
  }

  public String schemaKey() { return schemaKey; }

  /** Case-insensitive lookup by enum name, schema key or alias. */
  public static BackendKind fromName(String name) {
    Objects.requireNonNull(name, "name");
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (BackendKind k : values()) {
      if (k.name().toLowerCase(Locale.ROOT).equals(n) || k.schemaKey.equals(n) || k.aliases.contains(n)) return k;
    }
    throw new IllegalArgumentException("Unknown backend: " + name);
  }
}
