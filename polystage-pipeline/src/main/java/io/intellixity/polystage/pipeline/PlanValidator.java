package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.error.UnresolvedReferenceException;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.spi.pool.AdapterPool;
import io.intellixity.polystage.template.Placeholder;
import io.intellixity.polystage.template.TemplateScanner;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural checks run before any stage executes.\n
 *
 * Rejects with {@link InvalidPlanException}:\n
 * - placeholders referencing a missing, self or later stage (cause: {@link UnresolvedReferenceException})\n
 * - fields outside the referenced stage's declared output keys\n
 * - malformed placeholders and unknown policies\n
 * - duplicate output labels\n
 * - literal parameters using the reserved {@code _ref} prefix\n
 * - backends the adapter pool cannot serve\n
 */
public final class PlanValidator {
  /** Prefix of the parameter names generated for resolved placeholders. */
  public static final String RESERVED_PARAM_PREFIX = "_ref";

  private final AdapterPool adapters;

  public PlanValidator(AdapterPool adapters) {
    this.adapters = Objects.requireNonNull(adapters, "adapters");
  }

  public PreparedPlan validate(Plan plan) {
    Objects.requireNonNull(plan, "plan");
    if (plan.stages().isEmpty()) throw new InvalidPlanException("Plan has no stages");

    Set<String> labels = new HashSet<>();
    Map<Integer, List<Placeholder>> scanned = new HashMap<>();
    for (Stage s : plan.stages()) {
      if (!adapters.supports(s.backend())) {
        throw new InvalidPlanException("Stage " + s.index() + ": no adapter registered for " + s.backend().schemaKey());
      }
      if (s.outputLabel() != null && !labels.add(s.outputLabel())) {
        throw new InvalidPlanException("Duplicate output label '" + s.outputLabel() + "'");
      }
      for (String name : s.parameters().keySet()) {
        if (name.startsWith(RESERVED_PARAM_PREFIX)) {
          throw new InvalidPlanException("Stage " + s.index() + ": parameter name '" + name
              + "' uses the reserved prefix " + RESERVED_PARAM_PREFIX);
        }
      }

      List<Placeholder> phs = TemplateScanner.scan(s.queryTemplate());
      for (Placeholder p : phs) checkReference(plan, s, p);
      scanned.put(s.index(), phs);
    }
    return new PreparedPlan(plan, scanned);
  }

  private static void checkReference(Plan plan, Stage s, Placeholder p) {
    if (p.stageIndex() >= s.index()) {
      String which = p.stageIndex() == s.index() ? "itself" : "a later stage";
      UnresolvedReferenceException cause = new UnresolvedReferenceException(s.index(), p.reference(), "references " + which);
      throw new InvalidPlanException(cause.getMessage(), cause);
    }
    Stage source = plan.stage(p.stageIndex()).orElse(null);
    if (source == null) {
      UnresolvedReferenceException cause = new UnresolvedReferenceException(s.index(), p.reference(), "no such stage");
      throw new InvalidPlanException(cause.getMessage(), cause);
    }
    List<String> keys = source.outputKeys();
    if (!keys.isEmpty() && !keys.contains(p.rootField()) && !keys.contains(p.fieldPath())) {
      throw new InvalidPlanException("Stage " + s.index() + ": placeholder " + p.raw().trim()
          + " uses field '" + p.fieldPath() + "' not in stage " + source.index() + " output keys " + keys);
    }
  }
}
