package io.intellixity.polystage.schema;

import io.intellixity.polystage.model.BackendKind;

import java.util.Locale;

/** Semantic type of a declared field, independent of backend spelling. */
public enum FieldType {
  INTEGER,
  FLOAT,
  DECIMAL,
  STRING,
  BOOLEAN,
  TIMESTAMP,
  DATE,
  UUID,
  OBJECT_ID,
  JSON,
  ANY;

  /**
   * Parse a declared type name as written by schema inference for the given backend.\n
   *
   * Unknown or blank names are {@link #ANY}: the field exists but carries no usable type.\n
   */
  public static FieldType parse(BackendKind backend, String declared) {
    if (declared == null || declared.isBlank()) return ANY;
    String t = declared.trim().toLowerCase(Locale.ROOT);
    if (t.endsWith("[]") || t.startsWith("array") || t.startsWith("list")) return JSON;
    if (t.startsWith("timestamp") || t.equals("datetime") || t.equals("localdatetime") || t.equals("zoneddatetime")) {
      return TIMESTAMP;
    }
    if (t.equals("date")) return backend == BackendKind.DOCUMENT ? TIMESTAMP : DATE;
    return switch (t) {
      case "integer", "int", "int2", "int4", "int8", "smallint", "bigint", "long", "serial", "bigserial",
          "smallserial", "number" -> INTEGER;
      case "real", "float", "float4", "float8", "double", "double precision" -> FLOAT;
      case "numeric", "decimal", "decimal128", "money" -> DECIMAL;
      case "text", "string", "str", "varchar", "character varying", "character", "char", "bpchar", "name",
          "citext" -> STRING;
      case "boolean", "bool" -> BOOLEAN;
      case "uuid" -> UUID;
      case "objectid" -> OBJECT_ID;
      case "json", "jsonb", "object", "map", "document" -> JSON;
      default -> t.startsWith("character") || t.startsWith("varchar") ? STRING
          : t.startsWith("numeric") || t.startsWith("decimal") ? DECIMAL
          : ANY;
    };
  }
}
