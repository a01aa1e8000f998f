package io.intellixity.polystage.app.config;

import io.intellixity.polystage.pipeline.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.Objects;

/** Periodically drops expired result-cache entries so idle entries do not pin memory. */
public final class CacheSweeper implements SchedulingConfigurer {
  private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

  private final ResultCache cache;
  private final Duration interval;

  public CacheSweeper(ResultCache cache, Duration interval) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.interval = Objects.requireNonNull(interval, "interval");
  }

  public int sweep() {
    int removed = cache.sweepExpired();
    if (removed > 0) log.debug("polystage.cache op=sweep removed={} remaining={}", removed, cache.size());
    return removed;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar registrar) {
    registrar.addFixedDelayTask(this::sweep, interval);
  }
}
