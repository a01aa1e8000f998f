package io.intellixity.polystage.error;

import io.intellixity.polystage.model.BackendKind;

import java.util.Objects;

/**
 * Failure reported by a backend adapter.\n
 *
 * Transient errors (dropped connection, failover, deadlock) may succeed on retry; permanent ones
 * (malformed query, constraint violation) will not. Adapters never retry; the executor decides.\n
 */
public final class BackendException extends PolystageException {
  private final BackendKind backend;
  private final boolean transientError;

  public BackendException(BackendKind backend, boolean transientError, String message, Throwable cause) {
    super("[" + Objects.requireNonNull(backend, "backend").schemaKey() + (transientError ? ", transient] " : ", permanent] ") + message, cause);
    this.backend = backend;
    this.transientError = transientError;
  }

  public BackendException(BackendKind backend, boolean transientError, String message) {
    this(backend, transientError, message, null);
  }

  public BackendKind backend() { return backend; }

  public boolean isTransient() { return transientError; }
}
