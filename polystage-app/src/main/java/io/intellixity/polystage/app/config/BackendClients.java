package io.intellixity.polystage.app.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.polystage.jdbc.JdbcHandle;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.mongo.MongoHandle;
import io.intellixity.polystage.neo4j.Neo4jHandle;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Native clients for every configured backend, owned for the lifetime of the application.\n
 *
 * Clients are thread-safe and shared; adapters built over the handles each open their own connection or
 * session from them. Unconfigured backends get no client and no handle.\n
 */
public final class BackendClients implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackendClients.class);

  private final Map<BackendKind, AdapterHandle<?>> handles = new EnumMap<>(BackendKind.class);
  private final List<AutoCloseable> owned = new ArrayList<>();

  public BackendClients(PolystageProperties props) {
    Objects.requireNonNull(props, "props");
    try {
      if (props.getPostgres().isConfigured()) openPostgres(props.getPostgres());
      if (props.getMongo().isConfigured()) openMongo(props.getMongo());
      if (props.getNeo4j().isConfigured()) openNeo4j(props.getNeo4j());
    } catch (RuntimeException e) {
      close();
      throw e;
    }
  }

  public Map<BackendKind, AdapterHandle<?>> handles() {
    return Collections.unmodifiableMap(handles);
  }

  private void openPostgres(PolystageProperties.Postgres pg) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(pg.getJdbcUrl());
    hc.setUsername(pg.getUsername());
    hc.setPassword(pg.getPassword());
    hc.setMaximumPoolSize(pg.getPoolSize());
    hc.setPoolName("polystage-postgres");
    HikariDataSource ds = new HikariDataSource(hc);
    owned.add(ds);
    handles.put(BackendKind.RELATIONAL, new JdbcHandle("postgres", ds, pg.getSchema(), pg.getDialect()));
    log.info("polystage.clients op=open backend=postgres url={} schema={}", pg.getJdbcUrl(), pg.getSchema());
  }

  private void openMongo(PolystageProperties.Mongo m) {
    MongoClient client = MongoClients.create(m.getUri());
    owned.add(client);
    handles.put(BackendKind.DOCUMENT, new MongoHandle("mongodb", client, m.getDatabase()));
    log.info("polystage.clients op=open backend=mongodb database={}", m.getDatabase());
  }

  private void openNeo4j(PolystageProperties.Neo4j n) {
    AuthToken auth = (n.getUsername() == null || n.getUsername().isBlank())
        ? AuthTokens.none()
        : AuthTokens.basic(n.getUsername(), n.getPassword());
    Driver driver = GraphDatabase.driver(n.getUri(), auth);
    owned.add(driver);
    handles.put(BackendKind.GRAPH, new Neo4jHandle("neo4j", driver, n.getDatabase()));
    log.info("polystage.clients op=open backend=neo4j uri={} database={}", n.getUri(), n.getDatabase());
  }

  @Override
  public void close() {
    for (AutoCloseable c : owned) {
      try {
        c.close();
      } catch (Exception e) {
        log.warn("polystage.clients op=close client={} error={}", c.getClass().getSimpleName(), e.toString());
      }
    }
    owned.clear();
    handles.clear();
  }
}
