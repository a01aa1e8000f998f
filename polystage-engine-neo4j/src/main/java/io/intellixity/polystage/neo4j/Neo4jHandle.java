package io.intellixity.polystage.neo4j;

import io.intellixity.polystage.spi.handle.AdapterHandle;
import org.neo4j.driver.Driver;

import java.util.Objects;

/** Neo4j adapter handle; a null database means the server's default database. */
public final class Neo4jHandle implements AdapterHandle<Driver> {
  private final String id;
  private final Driver client;
  private final String database;

  public Neo4jHandle(String id, Driver client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  @Override public String id() { return id; }
  @Override public Driver client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
}
