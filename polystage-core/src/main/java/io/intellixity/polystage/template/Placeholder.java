package io.intellixity.polystage.template;

import io.intellixity.polystage.model.AggregationPolicy;

/**
 * One placeholder occurrence in a query template.\n
 *
 * [start, end) covers the raw token including surrounding quotes when {@link #quoted()}.\n
 */
public record Placeholder(
    String raw,
    int start,
    int end,
    int stageIndex,
    String fieldPath,
    AggregationPolicy policy,
    String targetEntity,
    String targetField,
    boolean quoted
) {
  /** "N.field.path" as written, without policy or target. */
  public String reference() {
    return stageIndex + "." + fieldPath;
  }

  public boolean policyExplicit() { return policy != null; }

  public AggregationPolicy effectivePolicy() {
    return policy == null ? AggregationPolicy.FIRST : policy;
  }

  /** Property looked up in the target schema: the explicit target or the last path segment. */
  public String targetProperty() {
    if (targetField != null) return targetField;
    int dot = fieldPath.lastIndexOf('.');
    return dot < 0 ? fieldPath : fieldPath.substring(dot + 1);
  }

  /** First path segment; this is what a stage's output keys constrain. */
  public String rootField() {
    int dot = fieldPath.indexOf('.');
    return dot < 0 ? fieldPath : fieldPath.substring(0, dot);
  }
}
