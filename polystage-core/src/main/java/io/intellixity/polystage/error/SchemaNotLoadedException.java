package io.intellixity.polystage.error;

import io.intellixity.polystage.model.BackendKind;

/** {@code SchemaRegistry.get} was called for a backend whose schema was never loaded. */
public final class SchemaNotLoadedException extends PolystageException {
  private final BackendKind backend;

  public SchemaNotLoadedException(BackendKind backend) {
    super("Schema not loaded for " + backend.schemaKey());
    this.backend = backend;
  }

  public BackendKind backend() { return backend; }
}
