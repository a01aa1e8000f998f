package io.intellixity.polystage.pipeline;

import java.time.Duration;
import java.util.Objects;

/** Fixed-backoff retry of transient backend failures: {@code maxRetries + 1} attempts in total. */
public record RetryPolicy(int maxRetries, Duration backoff) {
  public static final int DEFAULT_MAX_RETRIES = 2;
  public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(200);

  public RetryPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF);
  }
}
