package io.intellixity.polystage.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One backend-targeted step of a {@link Plan}.\n
 *
 * - index: execution ordinal; placeholders reference other stages by it\n
 * - parameters: literal bindings, insertion-ordered\n
 * - outputLabel: when set, the stage's rows are part of the final result\n
 * - outputKeys: when non-empty, the only fields later stages may reference\n
 */
public record Stage(
    int index,
    BackendKind backend,
    String queryTemplate,
    Map<String, Object> parameters,
    String outputLabel,
    List<String> outputKeys,
    String description
) {
  public Stage {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(queryTemplate, "queryTemplate");
    parameters = (parameters == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    outputLabel = (outputLabel == null || outputLabel.isBlank()) ? null : outputLabel.trim();
    outputKeys = (outputKeys == null) ? List.of() : List.copyOf(outputKeys);
  }

  public Stage(int index, BackendKind backend, String queryTemplate) {
    this(index, backend, queryTemplate, Map.of(), null, List.of(), null);
  }

  public Stage(int index, BackendKind backend, String queryTemplate, String outputLabel) {
    this(index, backend, queryTemplate, Map.of(), outputLabel, List.of(), null);
  }

  public boolean isOutput() { return outputLabel != null; }

  public Stage withParameters(Map<String, Object> params) {
    return new Stage(index, backend, queryTemplate, params, outputLabel, outputKeys, description);
  }

  public Stage withOutputKeys(List<String> keys) {
    return new Stage(index, backend, queryTemplate, parameters, outputLabel, keys, description);
  }
}
