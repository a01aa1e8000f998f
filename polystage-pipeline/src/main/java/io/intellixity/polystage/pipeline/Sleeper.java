package io.intellixity.polystage.pipeline;

import java.time.Duration;

/** Backoff clock; tests substitute one that records instead of sleeping. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
