package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.pipeline.cache.ResultCache;
import io.intellixity.polystage.schema.SchemaRegistry;
import io.intellixity.polystage.spi.pool.AdapterPool;

import java.util.Objects;

/**
 * Long-lived collaborators shared by every execution.\n
 *
 * Built once at startup and passed explicitly; nothing here is process-global.\n
 */
public record ServiceContext(SchemaRegistry schemas, AdapterPool adapters, ResultCache cache, PipelineSettings settings) {
  public ServiceContext {
    Objects.requireNonNull(schemas, "schemas");
    Objects.requireNonNull(adapters, "adapters");
    Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(settings, "settings");
  }
}
