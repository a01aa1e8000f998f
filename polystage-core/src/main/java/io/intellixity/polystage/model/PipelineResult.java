package io.intellixity.polystage.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final merged answer of a pipeline: output label -> rows, in stage order.\n
 *
 * Rows are deeply unmodifiable, so a cached result cannot be changed through a caller's copy.\n
 *
 * Warnings are diagnostics of the run that produced the result; they are not part of the JSON output.\n
 */
public final class PipelineResult {
  private final Map<String, List<Map<String, Object>>> outputs;
  private final List<MultipleValuesWarning> warnings;

  public PipelineResult(Map<String, List<Map<String, Object>>> outputs, List<MultipleValuesWarning> warnings) {
    Objects.requireNonNull(outputs, "outputs");
    Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
    for (var e : outputs.entrySet()) copy.put(e.getKey(), Rows.freeze(e.getValue()));
    this.outputs = Collections.unmodifiableMap(copy);
    this.warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
  }

  public Map<String, List<Map<String, Object>>> outputs() { return outputs; }

  public List<MultipleValuesWarning> warnings() { return warnings; }

  public List<Map<String, Object>> output(String label) {
    List<Map<String, Object>> rows = outputs.get(label);
    if (rows == null) throw new IllegalArgumentException("Unknown output label: " + label);
    return rows;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PipelineResult other)) return false;
    return outputs.equals(other.outputs) && warnings.equals(other.warnings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outputs, warnings);
  }

  @Override
  public String toString() {
    return "PipelineResult{labels=" + outputs.keySet() + ", warnings=" + warnings.size() + "}";
  }
}
