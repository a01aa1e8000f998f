package io.intellixity.polystage.app.translate;

import io.intellixity.polystage.model.Plan;

/**
 * Natural-language to plan translation, provided by an external service.\n
 *
 * {@code errorFeedback} is null on the first attempt; on later attempts it describes why the previous plan
 * failed so the translator can correct it. A translator that cannot produce a well-formed plan throws
 * {@link io.intellixity.polystage.error.InvalidPlanException}.\n
 */
@FunctionalInterface
public interface PlanTranslator {
  Plan translate(String naturalLanguageQuery, String errorFeedback);

  /** Placeholder used when no translator bean is configured. */
  static PlanTranslator unconfigured() {
    return (q, feedback) -> {
      throw new IllegalStateException("No PlanTranslator configured; run plans with --plan=<file>");
    };
  }
}
