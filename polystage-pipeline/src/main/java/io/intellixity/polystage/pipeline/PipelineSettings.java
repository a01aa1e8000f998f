package io.intellixity.polystage.pipeline;

import java.time.Duration;
import java.util.Objects;

/** Executor tuning: how long results stay cached and how transient failures are retried. */
public record PipelineSettings(Duration cacheTtl, RetryPolicy retry) {
  public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);

  public PipelineSettings {
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    Objects.requireNonNull(retry, "retry");
  }

  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_CACHE_TTL, RetryPolicy.defaults());
  }
}
