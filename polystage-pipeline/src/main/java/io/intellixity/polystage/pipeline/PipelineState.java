package io.intellixity.polystage.pipeline;

/** PENDING -> RUNNING -> {SUCCEEDED, FAILED}; a cache hit goes straight from PENDING to SUCCEEDED. */
public enum PipelineState {
  PENDING,
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
