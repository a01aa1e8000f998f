package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.error.BackendException;
import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.error.FailureReason;
import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.error.PipelineFailedException;
import io.intellixity.polystage.error.SchemaNotLoadedException;
import io.intellixity.polystage.error.SchemaUnavailableException;
import io.intellixity.polystage.error.UnresolvedReferenceException;
import io.intellixity.polystage.model.MultipleValuesWarning;
import io.intellixity.polystage.model.PipelineResult;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.model.StageResult;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs plans stage by stage.\n
 *
 * Per run:\n
 * - cache lookup by fingerprint; a hit returns without touching any backend\n
 * - validation ({@link InvalidPlanException} is thrown as is) and target-type binding for every stage\n
 * - stages in ascending ordinal order: cancellation checkpoint, placeholder resolution, dispatch with
 *   bounded retry of transient backend errors\n
 * - merge of labelled outputs and cache write\n
 *
 * Any failure after validation surfaces as {@link PipelineFailedException}; no partial result is returned.\n
 */
public final class PipelineExecutor {
  private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

  private final ServiceContext services;
  private final PlanValidator validator;
  private final PlaceholderResolver resolver;
  private final Sleeper sleeper;

  public PipelineExecutor(ServiceContext services) {
    this(services, Sleeper.SYSTEM);
  }

  public PipelineExecutor(ServiceContext services, Sleeper sleeper) {
    this.services = Objects.requireNonNull(services, "services");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.validator = new PlanValidator(services.adapters());
    this.resolver = new PlaceholderResolver(services.schemas());
  }

  public PipelineRun newRun(Plan plan) {
    return new PipelineRun(this, plan, new CancellationToken());
  }

  public PipelineRun newRun(Plan plan, CancellationToken token) {
    return new PipelineRun(this, plan, token);
  }

  public PipelineResult execute(Plan plan) {
    return newRun(plan).execute();
  }

  public PipelineResult execute(Plan plan, CancellationToken token) {
    return newRun(plan, token).execute();
  }

  PipelineResult run(PipelineRun run) {
    Plan plan = run.plan();
    String fp = plan.fingerprint();

    Optional<PipelineResult> cached = services.cache().get(fp);
    if (cached.isPresent()) {
      log.info("polystage.pipeline op=cacheHit fingerprint={} stages={}", fp, plan.size());
      run.transition(PipelineState.SUCCEEDED);
      return cached.get();
    }

    PreparedPlan prepared;
    try {
      prepared = validator.validate(plan);
    } catch (InvalidPlanException e) {
      run.transition(PipelineState.FAILED);
      log.warn("polystage.pipeline op=invalid fingerprint={} error={}", fp, e.getMessage());
      throw e;
    }

    List<BoundStage> bound = new ArrayList<>(plan.size());
    for (Stage s : plan.stages()) {
      try {
        bound.add(resolver.bind(s, prepared.placeholders(s.index())));
      } catch (CoercionException e) {
        throw fail(run, s, FailureReason.COERCION, e);
      } catch (SchemaNotLoadedException | SchemaUnavailableException e) {
        throw fail(run, s, FailureReason.SCHEMA, e);
      }
    }

    run.transition(PipelineState.RUNNING);
    log.info("polystage.pipeline op=start fingerprint={} stages={}", fp, plan.size());
    long t0 = System.nanoTime();

    ExecutionContext ctx = new ExecutionContext();
    List<MultipleValuesWarning> warnings = new ArrayList<>();
    try (AdapterSession session = new AdapterSession(services.adapters())) {
      for (BoundStage b : bound) {
        try {
          runStage(run, session, b, ctx, warnings);
        } catch (PipelineFailedException e) {
          throw e;
        } catch (RuntimeException e) {
          throw fail(run, b.stage(), FailureReason.BACKEND_PERMANENT, e);
        }
      }
    }

    PipelineResult result = ResultMerger.merge(plan, ctx, warnings);
    services.cache().put(fp, result, services.settings().cacheTtl());
    run.transition(PipelineState.SUCCEEDED);
    log.info("polystage.pipeline op=finish fingerprint={} labels={} durationMs={}",
        fp, result.outputs().keySet(), (System.nanoTime() - t0) / 1_000_000);
    return result;
  }

  private void runStage(PipelineRun run, AdapterSession session, BoundStage b, ExecutionContext ctx,
                        List<MultipleValuesWarning> warnings) {
    Stage s = b.stage();
    String fp = run.plan().fingerprint();
    if (run.token().isCancelled()) {
      throw fail(run, s, FailureReason.CANCELLED, new CancellationException("Cancelled before stage " + s.index()));
    }
    BackendAdapter adapter = acquire(run, session, s);
    ResolvedQuery q = resolve(run, b, ctx, adapter);
    for (MultipleValuesWarning w : q.warnings()) {
      log.warn("polystage.pipeline op=multipleValues fingerprint={} {}", fp, w.message());
    }
    warnings.addAll(q.warnings());
    List<Map<String, Object>> rows = dispatch(run, s, adapter, q);
    ctx.put(new StageResult(s.index(), s.backend(), rows));
    log.debug("polystage.pipeline op=stageDone fingerprint={} stage={} backend={} rows={}",
        fp, s.index(), s.backend().schemaKey(), rows.size());
  }

  private BackendAdapter acquire(PipelineRun run, AdapterSession session, Stage s) {
    try {
      return session.adapter(s.backend());
    } catch (BackendException e) {
      throw fail(run, s, e.isTransient() ? FailureReason.BACKEND_TRANSIENT : FailureReason.BACKEND_PERMANENT, e);
    }
  }

  private ResolvedQuery resolve(PipelineRun run, BoundStage b, ExecutionContext ctx, BackendAdapter adapter) {
    try {
      return resolver.resolve(b, ctx, adapter);
    } catch (UnresolvedReferenceException e) {
      throw fail(run, b.stage(), FailureReason.UNRESOLVED_REFERENCE, e);
    } catch (CoercionException e) {
      throw fail(run, b.stage(), FailureReason.COERCION, e);
    }
  }

  private List<Map<String, Object>> dispatch(PipelineRun run, Stage s, BackendAdapter adapter, ResolvedQuery q) {
    RetryPolicy retry = services.settings().retry();
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return adapter.execute(q.text(), q.params());
      } catch (BackendException e) {
        if (!e.isTransient()) throw fail(run, s, FailureReason.BACKEND_PERMANENT, e);
        if (attempt > retry.maxRetries()) throw fail(run, s, FailureReason.BACKEND_TRANSIENT, e);

        log.warn("polystage.pipeline op=retry stage={} backend={} attempt={} of={} error={}",
            s.index(), s.backend().schemaKey(), attempt, retry.maxRetries() + 1, e.getMessage());
        if (run.token().isCancelled()) {
          CancellationException ce = new CancellationException("Cancelled before retry of stage " + s.index());
          ce.initCause(e);
          throw fail(run, s, FailureReason.CANCELLED, ce);
        }
        try {
          sleeper.sleep(retry.backoff());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          CancellationException ce = new CancellationException("Interrupted during backoff of stage " + s.index());
          ce.initCause(ie);
          throw fail(run, s, FailureReason.CANCELLED, ce);
        }
      }
    }
  }

  private static PipelineFailedException fail(PipelineRun run, Stage s, FailureReason reason, Throwable cause) {
    run.transition(PipelineState.FAILED);
    log.warn("polystage.pipeline op=abort fingerprint={} stage={} backend={} reason={} error={}",
        run.plan().fingerprint(), s.index(), s.backend().schemaKey(), reason, cause.getMessage());
    return new PipelineFailedException(s.index(), s.backend(), reason, cause);
  }
}
