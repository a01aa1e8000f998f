package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.template.Placeholder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A validated plan with the placeholders scanned from each stage's template. */
public record PreparedPlan(Plan plan, Map<Integer, List<Placeholder>> placeholders) {
  public PreparedPlan {
    Objects.requireNonNull(plan, "plan");
    placeholders = Map.copyOf(placeholders);
  }

  public List<Placeholder> placeholders(int stageIndex) {
    return placeholders.getOrDefault(stageIndex, List.of());
  }
}
