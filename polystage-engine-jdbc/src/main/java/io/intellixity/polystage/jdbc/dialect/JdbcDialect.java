package io.intellixity.polystage.jdbc.dialect;

import io.intellixity.polystage.schema.FieldType;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Vendor-specific pieces of the JDBC adapter.\n
 *
 * Dialects are discovered through {@code META-INF/polystage.factories} under this interface's name.\n
 */
public interface JdbcDialect {
  String id();

  /** SQLState/exception-class based transient classification. */
  boolean isTransient(SQLException e);

  /** Native representation of an already coerced placeholder value. */
  Object toNative(Object value, FieldType targetType);

  void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException;

  /** Plain Java value for a driver value read from a result set. */
  Object fromDriver(Object raw) throws SQLException;
}
