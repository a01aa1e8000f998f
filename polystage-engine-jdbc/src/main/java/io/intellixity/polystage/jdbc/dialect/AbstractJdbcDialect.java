package io.intellixity.polystage.jdbc.dialect;

import io.intellixity.polystage.schema.FieldType;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Standard JDBC behavior shared by vendor dialects.\n
 *
 * Vendor dialects add SQLStates in {@link #isTransientSqlState(String)} and value conversions in
 * {@link #toNative} / {@link #fromDriverVendor}.\n
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {

  @Override
  public final boolean isTransient(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) return true;
      String state = cur.getSQLState();
      if (state != null && isTransientSqlState(state)) return true;
      if (cur.getNextException() == cur) break;
    }
    return false;
  }

  /** Class 08 (connection exception) and 40001 (serialization failure) are transient everywhere. */
  protected boolean isTransientSqlState(String sqlState) {
    return sqlState.startsWith("08") || sqlState.equals("40001");
  }

  @Override
  public Object toNative(Object value, FieldType targetType) {
    if (value instanceof Instant i) return OffsetDateTime.ofInstant(i, ZoneOffset.UTC);
    return value;
  }

  @Override
  public void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(position1Based, Types.NULL);
      return;
    }
    ps.setObject(position1Based, value);
  }

  @Override
  public final Object fromDriver(Object raw) throws SQLException {
    if (raw == null) return null;
    Object vendor = fromDriverVendor(raw);
    if (vendor != raw) return vendor;
    if (raw instanceof java.sql.Timestamp ts) return ts.toInstant();
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof java.sql.Time t) return t.toLocalTime();
    if (raw instanceof OffsetDateTime o) return o.toInstant();
    if (raw instanceof ZonedDateTime z) return z.toInstant();
    if (raw instanceof LocalDateTime l) return l.toInstant(ZoneOffset.UTC);
    if (raw instanceof Array a) {
      try {
        return arrayToList(a.getArray());
      } finally {
        a.free();
      }
    }
    if (raw instanceof Object[] oa) return arrayToList(oa);
    return raw;
  }

  /** Vendor types (e.g. PGobject); return {@code raw} itself when not handled. */
  protected Object fromDriverVendor(Object raw) throws SQLException {
    return raw;
  }

  private List<Object> arrayToList(Object arr) throws SQLException {
    if (!(arr instanceof Object[] oa)) {
      throw new SQLException("Unsupported primitive array type: " + arr.getClass().getName());
    }
    List<Object> out = new ArrayList<>(oa.length);
    for (Object o : Arrays.asList(oa)) out.add(fromDriver(o));
    return out;
  }
}
