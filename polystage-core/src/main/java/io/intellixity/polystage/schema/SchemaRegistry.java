package io.intellixity.polystage.schema;

import io.intellixity.polystage.error.SchemaNotLoadedException;
import io.intellixity.polystage.error.SchemaUnavailableException;
import io.intellixity.polystage.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-shared holder of per-backend schema snapshots.\n
 *
 * Reloads replace a snapshot with a single map put, so readers see either the old or the new
 * snapshot and never a mix.\n
 */
public final class SchemaRegistry {
  private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

  private final SchemaSource source;
  private final ConcurrentMap<BackendKind, SchemaSnapshot> snapshots = new ConcurrentHashMap<>();

  public SchemaRegistry(SchemaSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public SchemaSnapshot load(BackendKind backend) {
    Objects.requireNonNull(backend, "backend");
    SchemaSnapshot snap;
    try {
      snap = source.introspect(backend);
    } catch (SchemaUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SchemaUnavailableException(backend, e.getMessage(), e);
    }
    if (snap == null) throw new SchemaUnavailableException(backend, "source returned no snapshot");
    if (snap.backend() != backend) {
      throw new SchemaUnavailableException(backend, "source returned a " + snap.backend().schemaKey() + " snapshot");
    }
    snapshots.put(backend, snap);
    log.info("polystage.schema loaded backend={} entities={}", backend.schemaKey(), snap.fieldsByEntity().size());
    return snap;
  }

  /** Load every backend the source offers; returns the loaded kinds. */
  public Set<BackendKind> loadAll() {
    Set<BackendKind> loaded = EnumSet.noneOf(BackendKind.class);
    for (BackendKind k : source.available()) {
      load(k);
      loaded.add(k);
    }
    return loaded;
  }

  public SchemaSnapshot get(BackendKind backend) {
    SchemaSnapshot snap = snapshots.get(Objects.requireNonNull(backend, "backend"));
    if (snap == null) throw new SchemaNotLoadedException(backend);
    return snap;
  }

  public boolean isLoaded(BackendKind backend) {
    return snapshots.containsKey(backend);
  }
}
