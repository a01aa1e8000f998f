package io.intellixity.polystage.spi.adapter;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.util.PolystageFactoriesLoader;

import java.util.*;

/**
 * Adapter factory registry built via discovery (META-INF/polystage.factories).\n
 *
 * The first factory discovered for a kind wins; later ones are ignored.\n
 */
public final class DiscoveredAdapterFactories {
  private final Map<BackendKind, BackendAdapterFactory> byKind;

  public DiscoveredAdapterFactories() {
    this(PolystageFactoriesLoader.load(BackendAdapterFactory.class));
  }

  public DiscoveredAdapterFactories(List<BackendAdapterFactory> factories) {
    Map<BackendKind, BackendAdapterFactory> m = new EnumMap<>(BackendKind.class);
    for (BackendAdapterFactory f : factories) {
      if (f == null) continue;
      m.putIfAbsent(Objects.requireNonNull(f.kind(), "factory kind"), f);
    }
    this.byKind = Collections.unmodifiableMap(m);
  }

  public Set<BackendKind> kinds() { return byKind.keySet(); }

  public Optional<BackendAdapterFactory> find(BackendKind kind) {
    return Optional.ofNullable(byKind.get(kind));
  }

  public BackendAdapterFactory get(BackendKind kind) {
    BackendAdapterFactory f = byKind.get(kind);
    if (f == null) throw new IllegalArgumentException("No adapter factory for backend " + kind.schemaKey());
    return f;
  }
}
