package io.intellixity.polystage.jdbc;

import io.intellixity.polystage.spi.handle.AdapterHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC adapter handle (resolved by application code). */
public final class JdbcHandle implements AdapterHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;
  private final String dialectId;

  public JdbcHandle(String id, DataSource client, String schema, String dialectId) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? null : dialectId;
  }

  public JdbcHandle(String id, DataSource client, String schema) {
    this(id, client, schema, null);
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  /** Preferred dialect id; null picks the first discovered dialect. */
  public String dialectId() { return dialectId; }
}
