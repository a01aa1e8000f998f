package io.intellixity.polystage.schema;

import io.intellixity.polystage.error.SchemaUnavailableException;
import io.intellixity.polystage.model.BackendKind;

import java.util.Set;

/** Produces schema snapshots (schema-inference output, live introspection, fixtures). */
public interface SchemaSource {
  /**
   * Describe one backend.\n
   *
   * @throws SchemaUnavailableException if the backend cannot be described
   */
  SchemaSnapshot introspect(BackendKind backend);

  /** Backends this source can describe. */
  Set<BackendKind> available();
}
