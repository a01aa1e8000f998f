package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import io.intellixity.polystage.spi.pool.AdapterLease;
import io.intellixity.polystage.spi.pool.AdapterPool;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Leases held by one execution: at most one adapter per backend kind, leased on first use and
 * kept until {@link #close()}.
 */
final class AdapterSession implements AutoCloseable {
  private final AdapterPool pool;
  private final Map<BackendKind, AdapterLease> leases = new EnumMap<>(BackendKind.class);

  AdapterSession(AdapterPool pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  BackendAdapter adapter(BackendKind kind) {
    AdapterLease lease = leases.get(kind);
    if (lease == null) {
      lease = pool.lease(kind);
      leases.put(kind, lease);
    }
    return lease.adapter();
  }

  @Override
  public void close() {
    for (AdapterLease lease : leases.values()) lease.close();
    leases.clear();
  }
}
