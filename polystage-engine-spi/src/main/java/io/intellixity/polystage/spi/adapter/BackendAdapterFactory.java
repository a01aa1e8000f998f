package io.intellixity.polystage.spi.adapter;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.handle.AdapterHandle;

/**
 * Creates adapters for one backend kind.\n
 *
 * Implementations are discovered through {@code META-INF/polystage.factories} and must have a
 * public no-arg constructor.\n
 */
public interface BackendAdapterFactory {
  BackendKind kind();

  /** New adapter over {@code handle}; the adapter opens its connection lazily. */
  BackendAdapter create(AdapterHandle<?> handle);
}
