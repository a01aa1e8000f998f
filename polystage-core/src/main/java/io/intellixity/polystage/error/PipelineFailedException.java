package io.intellixity.polystage.error;

import io.intellixity.polystage.model.BackendKind;

import java.util.Objects;

/**
 * Terminal failure of a pipeline run.\n
 *
 * Always carries the stage that failed and the backend it targets; the originating error is the cause.\n
 */
public final class PipelineFailedException extends PolystageException {
  private final int stageIndex;
  private final BackendKind backend;
  private final FailureReason reason;

  public PipelineFailedException(int stageIndex, BackendKind backend, FailureReason reason, Throwable cause) {
    super("Pipeline failed at stage " + stageIndex + " (" + Objects.requireNonNull(backend, "backend").schemaKey()
        + ", " + Objects.requireNonNull(reason, "reason") + ")"
        + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
    this.stageIndex = stageIndex;
    this.backend = backend;
    this.reason = reason;
  }

  public int stageIndex() { return stageIndex; }

  public BackendKind backend() { return backend; }

  public FailureReason reason() { return reason; }
}
