package io.intellixity.polystage.jdbc;

import io.intellixity.polystage.jdbc.dialect.JdbcDialect;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.spi.adapter.AbstractBackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Relational adapter over a {@link javax.sql.DataSource}.\n
 *
 * Holds one connection, opened on first use and kept until a transient failure or {@link #close()}.
 * Statements run in auto-commit mode; a statement without a result set yields one row {@code {updateCount: n}}.\n
 */
public final class JdbcBackendAdapter extends AbstractBackendAdapter<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackendAdapter.class);

  private final JdbcDialect dialect;
  private Connection conn;

  public JdbcBackendAdapter(JdbcHandle handle, JdbcDialect dialect) {
    super(BackendKind.RELATIONAL, handle);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public JdbcDialect dialect() { return dialect; }

  @Override
  public String bindMarker(String paramName) {
    return ":" + paramName;
  }

  @Override
  protected Object toNative(Object value, FieldType targetType) {
    return dialect.toNative(value, targetType);
  }

  @Override
  protected List<Map<String, Object>> doExecute(String query, Map<String, Object> params) throws SQLException {
    SqlStatement ss = NamedSqlCompiler.compile(query, params);
    if (log.isDebugEnabled()) {
      log.debug("polystage.jdbc op=prepare dialect={} schema={} bindCount={} sql={}",
          dialect.id(), handle().schema(), ss.binds().size(), ss.sql());
    }
    Connection c = connection();
    try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
      for (int i = 0; i < ss.binds().size(); i++) dialect.bind(ps, i + 1, ss.binds().get(i));
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          return JdbcRowReader.readAll(rs, dialect);
        }
      }
      return List.of(Map.of("updateCount", ps.getUpdateCount()));
    }
  }

  @Override
  protected boolean isTransient(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SQLException se && dialect.isTransient(se)) return true;
      if (t.getCause() == t) break;
    }
    return false;
  }

  @Override
  protected void resetConnection() {
    Connection c = conn;
    conn = null;
    if (c == null) return;
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("polystage.jdbc op=close handleId={} error={}", handle().id(), e.toString());
    }
  }

  private Connection connection() throws SQLException {
    if (conn != null) return conn;
    Connection c = handle().client().getConnection();
    try {
      c.setAutoCommit(true);
      if (handle().schema() != null) c.setSchema(handle().schema());
    } catch (SQLException e) {
      try {
        c.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    conn = c;
    log.debug("polystage.jdbc op=open handleId={} schema={}", handle().id(), handle().schema());
    return c;
  }
}
