package io.intellixity.polystage.spi.pool;

import io.intellixity.polystage.spi.adapter.BackendAdapter;

import java.util.Objects;
import java.util.function.Consumer;

/** Exclusive use of one adapter until {@link #close()}. */
public final class AdapterLease implements AutoCloseable {
  private final BackendAdapter adapter;
  private final Consumer<BackendAdapter> release;
  private boolean released;

  public AdapterLease(BackendAdapter adapter, Consumer<BackendAdapter> release) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    this.release = Objects.requireNonNull(release, "release");
  }

  public BackendAdapter adapter() {
    if (released) throw new IllegalStateException("Lease already released");
    return adapter;
  }

  @Override
  public void close() {
    if (released) return;
    released = true;
    release.accept(adapter);
  }
}
