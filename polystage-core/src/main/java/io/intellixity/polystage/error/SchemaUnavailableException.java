package io.intellixity.polystage.error;

import io.intellixity.polystage.model.BackendKind;

/** The schema source could not describe a backend. */
public final class SchemaUnavailableException extends PolystageException {
  private final BackendKind backend;

  public SchemaUnavailableException(BackendKind backend, String message) {
    this(backend, message, null);
  }

  public SchemaUnavailableException(BackendKind backend, String message, Throwable cause) {
    super("Schema unavailable for " + backend.schemaKey() + ": " + message, cause);
    this.backend = backend;
  }

  public BackendKind backend() { return backend; }
}
