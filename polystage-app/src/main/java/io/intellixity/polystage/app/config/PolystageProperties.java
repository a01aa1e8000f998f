package io.intellixity.polystage.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "polystage")
public class PolystageProperties {
  private final Postgres postgres = new Postgres();
  private final Mongo mongo = new Mongo();
  private final Neo4j neo4j = new Neo4j();
  private final Cache cache = new Cache();
  private final Retry retry = new Retry();
  private final Adapters adapters = new Adapters();
  private final Translation translation = new Translation();

  /** Schema-inference JSON with "postgres", "neo4j" and "mongodb" sections. */
  private String schemaFile;

  public Postgres getPostgres() { return postgres; }
  public Mongo getMongo() { return mongo; }
  public Neo4j getNeo4j() { return neo4j; }
  public Cache getCache() { return cache; }
  public Retry getRetry() { return retry; }
  public Adapters getAdapters() { return adapters; }
  public Translation getTranslation() { return translation; }
  public String getSchemaFile() { return schemaFile; }
  public void setSchemaFile(String schemaFile) { this.schemaFile = schemaFile; }

  private static boolean present(String s) {
    return s != null && !s.isBlank();
  }

  public static class Postgres {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int poolSize = 10;

    /** Dialect id registered under META-INF/polystage.factories; blank picks the discovered one. */
    private String dialect;

    public boolean isConfigured() { return present(jdbcUrl); }

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
  }

  public static class Mongo {
    private String uri;
    private String database;

    public boolean isConfigured() { return present(uri) && present(database); }

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Neo4j {
    private String uri;
    private String username;
    private String password;

    /** Blank means the server's default database. */
    private String database;

    public boolean isConfigured() { return present(uri); }

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Cache {
    private Duration ttl = Duration.ofMinutes(10);
    private int maxEntries = 1000;
    private Duration sweepInterval = Duration.ofMinutes(1);

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
  }

  public static class Retry {
    private int maxRetries = 2;
    private Duration backoff = Duration.ofMillis(200);

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getBackoff() { return backoff; }
    public void setBackoff(Duration backoff) { this.backoff = backoff; }
  }

  public static class Adapters {
    private int maxPerBackend = 4;
    private Duration leaseTimeout = Duration.ofSeconds(5);

    public int getMaxPerBackend() { return maxPerBackend; }
    public void setMaxPerBackend(int maxPerBackend) { this.maxPerBackend = maxPerBackend; }
    public Duration getLeaseTimeout() { return leaseTimeout; }
    public void setLeaseTimeout(Duration leaseTimeout) { this.leaseTimeout = leaseTimeout; }
  }

  public static class Translation {
    private int maxAttempts = 3;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
  }
}
