package io.intellixity.polystage.jdbc;

import io.intellixity.polystage.jdbc.dialect.AnsiJdbcDialect;
import io.intellixity.polystage.jdbc.dialect.JdbcDialect;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import io.intellixity.polystage.spi.adapter.BackendAdapterFactory;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import io.intellixity.polystage.util.PolystageFactoriesLoader;

import java.util.List;

/**
 * Creates {@link JdbcBackendAdapter}s.\n
 *
 * Dialect resolution: the dialect whose id matches {@link JdbcHandle#dialectId()}, else the first discovered
 * dialect, else {@link AnsiJdbcDialect}.\n
 */
public final class JdbcBackendAdapterFactory implements BackendAdapterFactory {
  private final List<JdbcDialect> dialects;

  public JdbcBackendAdapterFactory() {
    this(PolystageFactoriesLoader.load(JdbcDialect.class));
  }

  public JdbcBackendAdapterFactory(List<JdbcDialect> dialects) {
    this.dialects = List.copyOf(dialects);
  }

  @Override public BackendKind kind() { return BackendKind.RELATIONAL; }

  @Override
  public BackendAdapter create(AdapterHandle<?> handle) {
    if (!(handle instanceof JdbcHandle jh)) {
      throw new IllegalArgumentException("Expected JdbcHandle, got " + (handle == null ? "null" : handle.getClass().getName()));
    }
    return new JdbcBackendAdapter(jh, dialectFor(jh));
  }

  JdbcDialect dialectFor(JdbcHandle handle) {
    if (handle.dialectId() != null) {
      for (JdbcDialect d : dialects) {
        if (d.id().equalsIgnoreCase(handle.dialectId())) return d;
      }
      throw new IllegalArgumentException("Unknown JDBC dialect: " + handle.dialectId());
    }
    return dialects.isEmpty() ? new AnsiJdbcDialect() : dialects.get(0);
  }
}
