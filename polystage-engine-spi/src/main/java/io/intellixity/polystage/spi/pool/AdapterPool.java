package io.intellixity.polystage.spi.pool;

import io.intellixity.polystage.model.BackendKind;

/**
 * Hands out adapters for exclusive use.\n
 *
 * Lease and release are the only synchronization points between concurrent executions.\n
 */
public interface AdapterPool extends AutoCloseable {
  boolean supports(BackendKind kind);

  /** Blocks up to the pool's lease timeout. */
  AdapterLease lease(BackendKind kind);

  @Override
  void close();
}
