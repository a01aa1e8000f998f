package io.intellixity.polystage.spi.adapter;

import io.intellixity.polystage.error.BackendException;
import io.intellixity.polystage.mapping.Coercions;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Template-method base for backend adapters.\n
 *
 * Responsibilities:\n
 * - Logging and timing around every statement (parameter names and types only, never values)\n
 * - Classifying failures via {@link #isTransient(Throwable)} and wrapping them in {@link BackendException}\n
 * - Dropping the connection after a transient failure so the next call reopens it\n
 * - Semantic coercion before the backend-native conversion in {@link #toNative(Object, FieldType)}\n
 */
public abstract class AbstractBackendAdapter<H extends AdapterHandle<?>> implements BackendAdapter {
  private static final Logger log = LoggerFactory.getLogger(AbstractBackendAdapter.class);

  private final BackendKind kind;
  private final H handle;
  private boolean closed;

  protected AbstractBackendAdapter(BackendKind kind, H handle) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /** Run the statement on the (lazily opened) connection. */
  protected abstract List<Map<String, Object>> doExecute(String query, Map<String, Object> params) throws Exception;

  /** True when retrying the same statement may succeed (connectivity, failover, serialization conflicts). */
  protected abstract boolean isTransient(Throwable error);

  /** Release the current connection/session; the next {@link #doExecute} opens a new one. */
  protected abstract void resetConnection();

  /** Backend-native representation of an already coerced scalar. */
  protected Object toNative(Object value, FieldType targetType) {
    return value;
  }

  @Override public final BackendKind kind() { return kind; }

  public final H handle() { return handle; }

  @Override
  public final List<Map<String, Object>> execute(String query, Map<String, Object> params) {
    Objects.requireNonNull(query, "query");
    if (closed) throw new IllegalStateException(kind.schemaKey() + " adapter is closed");
    Map<String, Object> p = (params == null) ? Map.of() : params;
    debugStatement(query, p);
    long start = System.nanoTime();
    try {
      List<Map<String, Object>> rows = doExecute(query, p);
      if (log.isDebugEnabled()) {
        log.debug("polystage.adapter_done backend={} handleId={} rows={} durationMs={}",
            kind.schemaKey(), handle.id(), rows.size(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return rows;
    } catch (BackendException e) {
      throw e;
    } catch (Exception e) {
      boolean transientError = isTransient(e);
      log.debug("polystage.adapter_failed backend={} handleId={} transient={} error={}",
          kind.schemaKey(), handle.id(), transientError, e.toString());
      if (transientError) resetConnection();
      throw new BackendException(kind, transientError,
          kind.schemaKey() + " query failed: " + e.getMessage(), e);
    }
  }

  @Override
  public final Object translatePlaceholderValue(Object rawValue, FieldType targetType) {
    Objects.requireNonNull(targetType, "targetType");
    if (rawValue instanceof Collection<?> c) {
      List<Object> coerced = Coercions.coerceAll(c, targetType);
      coerced.replaceAll(v -> v == null ? null : toNative(v, targetType));
      return coerced;
    }
    Object coerced = Coercions.coerce(rawValue, targetType);
    return coerced == null ? null : toNative(coerced, targetType);
  }

  @Override
  public final void close() {
    if (closed) return;
    closed = true;
    resetConnection();
  }

  protected final boolean isClosed() { return closed; }

  private void debugStatement(String query, Map<String, Object> params) {
    if (!log.isDebugEnabled()) return;
    StringJoiner types = new StringJoiner(",", "[", "]");
    for (var e : params.entrySet()) {
      Object v = e.getValue();
      types.add(e.getKey() + ":" + (v == null ? "null" : v.getClass().getSimpleName()));
    }
    log.debug("polystage.adapter op=execute backend={} handleId={} namespace={} paramCount={} params={} query={}",
        kind.schemaKey(), handle.id(), handle.namespace(), params.size(), types, query);
  }
}
