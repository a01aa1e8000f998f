package io.intellixity.polystage.app.service;

import io.intellixity.polystage.app.translate.PlanTranslator;
import io.intellixity.polystage.error.FailureReason;
import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.error.PipelineFailedException;
import io.intellixity.polystage.error.PolystageException;
import io.intellixity.polystage.model.PipelineResult;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.pipeline.CancellationToken;
import io.intellixity.polystage.pipeline.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Answers a natural-language query: translate, execute, and on a rejected or failed plan translate again
 * with the error as feedback, up to {@code maxAttempts} translations. Cancellation is never retried.
 */
public final class QueryService {
  private static final Logger log = LoggerFactory.getLogger(QueryService.class);

  private final PlanTranslator translator;
  private final PipelineExecutor executor;
  private final int maxAttempts;

  public QueryService(PlanTranslator translator, PipelineExecutor executor, int maxAttempts) {
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.maxAttempts = maxAttempts;
  }

  public PipelineResult answer(String query) {
    return answer(query, new CancellationToken());
  }

  public PipelineResult answer(String query, CancellationToken token) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(token, "token");
    String feedback = null;
    PolystageException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        Plan plan = translator.translate(query, feedback);
        return executor.execute(plan, token);
      } catch (InvalidPlanException e) {
        last = e;
      } catch (PipelineFailedException e) {
        if (e.reason() == FailureReason.CANCELLED) throw e;
        last = e;
      }
      log.warn("polystage.query op=attemptFailed attempt={} of={} error={}", attempt, maxAttempts, last.getMessage());
      feedback = feedbackFor(last);
    }
    throw last;
  }

  static String feedbackFor(PolystageException error) {
    StringBuilder sb = new StringBuilder("Previous attempt failed with error: ").append(error.getMessage());
    if (error instanceof PipelineFailedException pf) {
      sb.append("\nFailing stage: ").append(pf.stageIndex())
          .append(" (").append(pf.backend().schemaKey()).append("), reason ").append(pf.reason());
    }
    sb.append("\nFix the plan and try again: database names must be one of postgres, neo4j, mongodb; ")
        .append("referenced columns and properties must exist; placeholders may only reference earlier stages.");
    return sb.toString();
  }
}
