package io.intellixity.polystage.app.config;

import io.intellixity.polystage.app.cli.PlanFileRunner;
import io.intellixity.polystage.app.service.QueryService;
import io.intellixity.polystage.app.translate.PlanTranslator;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.pipeline.PipelineExecutor;
import io.intellixity.polystage.pipeline.PipelineSettings;
import io.intellixity.polystage.pipeline.RetryPolicy;
import io.intellixity.polystage.pipeline.ServiceContext;
import io.intellixity.polystage.pipeline.cache.InMemoryResultCache;
import io.intellixity.polystage.pipeline.cache.ResultCache;
import io.intellixity.polystage.schema.JsonSchemaSource;
import io.intellixity.polystage.schema.SchemaRegistry;
import io.intellixity.polystage.spi.adapter.BackendAdapterFactory;
import io.intellixity.polystage.spi.adapter.DiscoveredAdapterFactories;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import io.intellixity.polystage.spi.pool.BlockingAdapterPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.util.Map;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(PolystageProperties.class)
public class PolystageConfig {
  private static final Logger log = LoggerFactory.getLogger(PolystageConfig.class);

  @Bean(destroyMethod = "close")
  public BackendClients backendClients(PolystageProperties props) {
    return new BackendClients(props);
  }

  @Bean
  public DiscoveredAdapterFactories adapterFactories() {
    return new DiscoveredAdapterFactories();
  }

  @Bean(destroyMethod = "close")
  public BlockingAdapterPool adapterPool(BackendClients clients, DiscoveredAdapterFactories factories, PolystageProperties props) {
    PolystageProperties.Adapters cfg = props.getAdapters();
    BlockingAdapterPool pool = new BlockingAdapterPool(cfg.getLeaseTimeout());
    for (Map.Entry<BackendKind, AdapterHandle<?>> e : clients.handles().entrySet()) {
      BackendAdapterFactory factory = factories.get(e.getKey());
      AdapterHandle<?> handle = e.getValue();
      pool.register(e.getKey(), () -> factory.create(handle), cfg.getMaxPerBackend());
    }
    if (clients.handles().isEmpty()) log.warn("polystage.config op=pool no backend is configured");
    return pool;
  }

  @Bean
  public SchemaRegistry schemaRegistry(PolystageProperties props) {
    String file = props.getSchemaFile();
    if (file == null || file.isBlank()) throw new IllegalStateException("polystage.schema-file is not set");
    SchemaRegistry registry = new SchemaRegistry(JsonSchemaSource.fromFile(Path.of(file)));
    registry.loadAll();
    return registry;
  }

  @Bean
  public ResultCache resultCache(PolystageProperties props) {
    return new InMemoryResultCache(props.getCache().getMaxEntries());
  }

  @Bean
  public CacheSweeper cacheSweeper(ResultCache cache, PolystageProperties props) {
    return new CacheSweeper(cache, props.getCache().getSweepInterval());
  }

  @Bean
  public ServiceContext serviceContext(SchemaRegistry schemas, BlockingAdapterPool pool, ResultCache cache,
                                       PolystageProperties props) {
    RetryPolicy retry = new RetryPolicy(props.getRetry().getMaxRetries(), props.getRetry().getBackoff());
    return new ServiceContext(schemas, pool, cache, new PipelineSettings(props.getCache().getTtl(), retry));
  }

  @Bean
  public PipelineExecutor pipelineExecutor(ServiceContext services) {
    return new PipelineExecutor(services);
  }

  @Bean
  public QueryService queryService(ObjectProvider<PlanTranslator> translator, PipelineExecutor executor,
                                   PolystageProperties props) {
    return new QueryService(translator.getIfAvailable(PlanTranslator::unconfigured), executor,
        props.getTranslation().getMaxAttempts());
  }

  @Bean
  public PlanFileRunner planFileRunner(PipelineExecutor executor) {
    return new PlanFileRunner(executor);
  }
}
