package io.intellixity.polystage.spi.handle;

/**
 * Resolved runtime handle for one backend.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 * - Mongo: client() is MongoClient, namespace() is database\n
 * - Neo4j: client() is Driver, namespace() is database\n
 */
public interface AdapterHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an adapter (DataSource, MongoClient, Driver). */
  TClient client();

  /** Namespace (schema/database) for this handle; may be null for the backend default. */
  String namespace();
}
