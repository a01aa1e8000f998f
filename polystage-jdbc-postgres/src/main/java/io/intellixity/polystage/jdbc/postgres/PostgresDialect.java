package io.intellixity.polystage.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.polystage.jdbc.dialect.AbstractJdbcDialect;
import io.intellixity.polystage.jdbc.dialect.JdbcDialect;
import io.intellixity.polystage.json.Json;
import io.intellixity.polystage.schema.FieldType;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.util.Set;

/**
 * PostgreSQL dialect.\n
 *
 * Keeps only Postgres-specific SQLStates and value conversions; generic JDBC handling lives in
 * {@link AbstractJdbcDialect}.\n
 */
public final class PostgresDialect extends AbstractJdbcDialect implements JdbcDialect {
  /** deadlock_detected, admin/crash shutdown, cannot_connect_now, too_many_connections. */
  private static final Set<String> TRANSIENT_STATES = Set.of("40P01", "57P01", "57P02", "57P03", "53300");

  @Override public String id() { return "postgres"; }

  @Override
  protected boolean isTransientSqlState(String sqlState) {
    return super.isTransientSqlState(sqlState) || TRANSIENT_STATES.contains(sqlState);
  }

  @Override
  public Object toNative(Object value, FieldType targetType) {
    if (targetType == FieldType.JSON && !(value instanceof PGobject)) return jsonb(value);
    return super.toNative(value, targetType);
  }

  @Override
  protected Object fromDriverVendor(Object raw) throws SQLException {
    if (!(raw instanceof PGobject pg)) return raw;
    String type = pg.getType();
    String v = pg.getValue();
    if (v == null) return null;
    if ("json".equals(type) || "jsonb".equals(type)) {
      try {
        return Json.mapper().readValue(v, Object.class);
      } catch (JsonProcessingException e) {
        throw new SQLException("Invalid " + type + " value from server", e);
      }
    }
    return v;
  }

  static PGobject jsonb(Object value) {
    try {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      obj.setValue(value instanceof String s ? s : Json.mapper().writeValueAsString(value));
      return obj;
    } catch (JsonProcessingException | SQLException e) {
      throw new IllegalArgumentException("Cannot encode value as jsonb", e);
    }
  }
}
