package io.intellixity.polystage.model;

import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.plan.PlanFingerprinter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered stage list produced by the query translator.\n
 *
 * Stages are kept in ascending ordinal order regardless of input order. The fingerprint is computed
 * once at construction and is the result-cache key.\n
 */
public final class Plan {
  private final List<Stage> stages;
  private final String fingerprint;

  private Plan(List<Stage> stages) {
    this.stages = stages;
    this.fingerprint = PlanFingerprinter.fingerprint(stages);
  }

  public static Plan of(List<Stage> stages) {
    Objects.requireNonNull(stages, "stages");
    if (stages.isEmpty()) throw new InvalidPlanException("Plan has no stages");
    List<Stage> sorted = new ArrayList<>(stages);
    for (Stage s : sorted) Objects.requireNonNull(s, "stage");
    sorted.sort(Comparator.comparingInt(Stage::index));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).index() == sorted.get(i - 1).index()) {
        throw new InvalidPlanException("Duplicate stage index " + sorted.get(i).index());
      }
    }
    return new Plan(List.copyOf(sorted));
  }

  public static Plan of(Stage... stages) {
    return of(List.of(stages));
  }

  public List<Stage> stages() { return stages; }

  public String fingerprint() { return fingerprint; }

  public int size() { return stages.size(); }

  public Stage last() { return stages.get(stages.size() - 1); }

  public Optional<Stage> stage(int index) {
    for (Stage s : stages) {
      if (s.index() == index) return Optional.of(s);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "Plan{stages=" + stages.size() + ", fingerprint=" + fingerprint + "}";
  }
}
