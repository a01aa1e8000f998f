package io.intellixity.polystage.spi.adapter;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.schema.FieldType;

import java.util.List;
import java.util.Map;

/**
 * Uniform execution surface over one backend connection.\n
 *
 * An adapter is used by one pipeline execution at a time (see {@code AdapterPool}); it is not thread-safe.\n
 */
public interface BackendAdapter extends AutoCloseable {
  BackendKind kind();

  /**
   * Run one native query with named parameters.\n
   *
   * Fails with {@link io.intellixity.polystage.error.BackendException} classified transient or permanent.
   * Never retries.\n
   */
  List<Map<String, Object>> execute(String query, Map<String, Object> params);

  /**
   * Coerce a value taken from an earlier stage into what this backend expects for a field of {@code targetType}.
   * Collections are coerced element-wise.
   */
  Object translatePlaceholderValue(Object rawValue, FieldType targetType);

  /** Native parameter reference for {@code paramName}, as written into query text. */
  String bindMarker(String paramName);

  @Override
  void close();
}
