package io.intellixity.polystage.neo4j;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import io.intellixity.polystage.spi.adapter.BackendAdapterFactory;
import io.intellixity.polystage.spi.handle.AdapterHandle;

/** Creates {@link Neo4jBackendAdapter}s over a {@link Neo4jHandle}. */
public final class Neo4jBackendAdapterFactory implements BackendAdapterFactory {
  @Override public BackendKind kind() { return BackendKind.GRAPH; }

  @Override
  public BackendAdapter create(AdapterHandle<?> handle) {
    if (!(handle instanceof Neo4jHandle nh)) {
      throw new IllegalArgumentException("Expected Neo4jHandle, got " + (handle == null ? "null" : handle.getClass().getName()));
    }
    return new Neo4jBackendAdapter(nh);
  }
}
