package io.intellixity.polystage.spi.pool;

import io.intellixity.polystage.error.BackendException;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded per-backend adapter pool.\n
 *
 * - Adapters are created lazily up to {@code maxAdapters} per kind\n
 * - Idle adapters are reused most-recently-released first\n
 * - A lease waits at most {@code leaseTimeout}; timing out is a transient backend error\n
 */
public final class BlockingAdapterPool implements AdapterPool {
  private static final Logger log = LoggerFactory.getLogger(BlockingAdapterPool.class);

  private final Duration leaseTimeout;
  private final Map<BackendKind, Slot> slots = new EnumMap<>(BackendKind.class);
  private volatile boolean closed;

  private static final class Slot {
    final Supplier<? extends BackendAdapter> factory;
    final Semaphore permits;
    final ConcurrentLinkedDeque<BackendAdapter> idle = new ConcurrentLinkedDeque<>();

    Slot(Supplier<? extends BackendAdapter> factory, int maxAdapters) {
      this.factory = factory;
      this.permits = new Semaphore(maxAdapters, true);
    }
  }

  public BlockingAdapterPool(Duration leaseTimeout) {
    this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
    if (leaseTimeout.isNegative()) throw new IllegalArgumentException("leaseTimeout must be >= 0");
  }

  /** Register (or replace) the adapter supplier for {@code kind}. Call before the pool is shared. */
  public synchronized BlockingAdapterPool register(BackendKind kind, Supplier<? extends BackendAdapter> factory, int maxAdapters) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(factory, "factory");
    if (maxAdapters <= 0) throw new IllegalArgumentException("maxAdapters must be > 0");
    Slot prev = slots.put(kind, new Slot(factory, maxAdapters));
    if (prev != null) closeIdle(prev);
    log.info("polystage.pool registered backend={} maxAdapters={}", kind.schemaKey(), maxAdapters);
    return this;
  }

  @Override
  public synchronized boolean supports(BackendKind kind) {
    return slots.containsKey(kind);
  }

  @Override
  public AdapterLease lease(BackendKind kind) {
    if (closed) throw new IllegalStateException("Adapter pool is closed");
    Slot slot;
    synchronized (this) {
      slot = slots.get(kind);
    }
    if (slot == null) throw new IllegalArgumentException("No adapter registered for backend " + kind.schemaKey());

    try {
      if (!slot.permits.tryAcquire(leaseTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new BackendException(kind, true, "Timed out after " + leaseTimeout.toMillis() + "ms waiting for a "
            + kind.schemaKey() + " adapter");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException(kind, false, "Interrupted while waiting for a " + kind.schemaKey() + " adapter", e);
    }

    BackendAdapter adapter = slot.idle.pollFirst();
    if (adapter == null) {
      try {
        adapter = Objects.requireNonNull(slot.factory.get(), "adapter factory returned null");
      } catch (RuntimeException e) {
        slot.permits.release();
        throw e;
      }
    }
    return new AdapterLease(adapter, a -> release(slot, a));
  }

  private void release(Slot slot, BackendAdapter adapter) {
    try {
      if (closed) {
        closeQuietly(adapter);
      } else {
        slot.idle.offerFirst(adapter);
        // close() may have drained the slot between the check and the offer
        if (closed) closeIdle(slot);
      }
    } finally {
      slot.permits.release();
    }
  }

  /** Idle adapters per kind (for diagnostics and tests). */
  public int idleCount(BackendKind kind) {
    Slot slot;
    synchronized (this) {
      slot = slots.get(kind);
    }
    return slot == null ? 0 : slot.idle.size();
  }

  @Override
  public void close() {
    List<Slot> all;
    synchronized (this) {
      if (closed) return;
      closed = true;
      all = new ArrayList<>(slots.values());
    }
    for (Slot s : all) closeIdle(s);
  }

  private static void closeIdle(Slot slot) {
    BackendAdapter a;
    while ((a = slot.idle.pollFirst()) != null) closeQuietly(a);
  }

  private static void closeQuietly(BackendAdapter adapter) {
    try {
      adapter.close();
    } catch (RuntimeException e) {
      log.warn("polystage.pool close_failed backend={} error={}", adapter.kind().schemaKey(), e.toString());
    }
  }
}
