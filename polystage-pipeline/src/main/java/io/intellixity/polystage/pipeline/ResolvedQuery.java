package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.MultipleValuesWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Query text with native bind markers plus the full parameter map (literal and resolved). */
public record ResolvedQuery(String text, Map<String, Object> params, List<MultipleValuesWarning> warnings) {
  public ResolvedQuery {
    Objects.requireNonNull(text, "text");
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    warnings = List.copyOf(warnings);
  }
}
