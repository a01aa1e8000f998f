package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.PipelineResult;
import io.intellixity.polystage.model.Plan;

import java.util.Objects;

/**
 * One execution of a plan.\n
 *
 * {@link #execute()} runs on the caller's thread and may be called once; {@link #cancel()} and
 * {@link #state()} may be called from any thread.\n
 */
public final class PipelineRun {
  private final PipelineExecutor executor;
  private final Plan plan;
  private final CancellationToken token;
  private volatile PipelineState state = PipelineState.PENDING;
  private boolean started;

  PipelineRun(PipelineExecutor executor, Plan plan, CancellationToken token) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.plan = Objects.requireNonNull(plan, "plan");
    this.token = Objects.requireNonNull(token, "token");
  }

  public PipelineResult execute() {
    synchronized (this) {
      if (started) throw new IllegalStateException("PipelineRun already executed");
      started = true;
    }
    return executor.run(this);
  }

  public void cancel() {
    token.cancel();
  }

  public PipelineState state() { return state; }

  public Plan plan() { return plan; }

  CancellationToken token() { return token; }

  void transition(PipelineState next) {
    state = next;
  }
}
