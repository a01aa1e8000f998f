package io.intellixity.polystage.mongo;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import io.intellixity.polystage.spi.adapter.BackendAdapterFactory;
import io.intellixity.polystage.spi.handle.AdapterHandle;

/** Creates {@link MongoBackendAdapter}s over a {@link MongoHandle}. */
public final class MongoBackendAdapterFactory implements BackendAdapterFactory {
  @Override public BackendKind kind() { return BackendKind.DOCUMENT; }

  @Override
  public BackendAdapter create(AdapterHandle<?> handle) {
    if (!(handle instanceof MongoHandle mh)) {
      throw new IllegalArgumentException("Expected MongoHandle, got " + (handle == null ? "null" : handle.getClass().getName()));
    }
    return new MongoBackendAdapter(mh);
  }
}
