package io.intellixity.polystage.app.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PolystagePropertiesTest {

  private static PolystageProperties bind(Map<String, String> values) {
    Binder binder = new Binder(new MapConfigurationPropertySource(values));
    return binder.bind("polystage", Bindable.ofInstance(new PolystageProperties())).orElseGet(PolystageProperties::new);
  }

  @Test
  void bindsKebabCaseKeysAndDurations() {
    PolystageProperties p = bind(Map.of(
        "polystage.schema-file", "/etc/polystage/schema.json",
        "polystage.postgres.jdbc-url", "jdbc:postgresql://db:5432/movies",
        "polystage.postgres.pool-size", "3",
        "polystage.cache.ttl", "30s",
        "polystage.retry.backoff", "50ms",
        "polystage.adapters.max-per-backend", "2",
        "polystage.translation.max-attempts", "5"));

    assertEquals("/etc/polystage/schema.json", p.getSchemaFile());
    assertTrue(p.getPostgres().isConfigured());
    assertEquals(3, p.getPostgres().getPoolSize());
    assertEquals("public", p.getPostgres().getSchema());
    assertEquals(Duration.ofSeconds(30), p.getCache().getTtl());
    assertEquals(Duration.ofMillis(50), p.getRetry().getBackoff());
    assertEquals(2, p.getRetry().getMaxRetries());
    assertEquals(2, p.getAdapters().getMaxPerBackend());
    assertEquals(5, p.getTranslation().getMaxAttempts());
  }

  @Test
  void backendsWithoutConnectionSettingsAreNotConfigured() {
    PolystageProperties p = bind(Map.of("polystage.mongo.uri", "mongodb://localhost"));
    assertFalse(p.getPostgres().isConfigured());
    assertFalse(p.getMongo().isConfigured());
    assertFalse(p.getNeo4j().isConfigured());
  }

  @Test
  void noConfiguredBackendMeansNoHandles() {
    try (BackendClients clients = new BackendClients(new PolystageProperties())) {
      assertTrue(clients.handles().isEmpty());
    }
  }
}
