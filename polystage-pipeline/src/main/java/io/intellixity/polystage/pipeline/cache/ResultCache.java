package io.intellixity.polystage.pipeline.cache;

import io.intellixity.polystage.model.PipelineResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Fingerprint-keyed store of successful pipeline results.\n
 *
 * An entry is never returned once its TTL has elapsed.\n
 */
public interface ResultCache {
  Optional<PipelineResult> get(String fingerprint);

  /** A non-positive ttl stores nothing. */
  void put(String fingerprint, PipelineResult result, Duration ttl);

  /** Drop every expired entry; returns how many were removed. */
  int sweepExpired();

  int size();
}
