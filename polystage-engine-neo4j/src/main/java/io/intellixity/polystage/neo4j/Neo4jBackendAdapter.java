package io.intellixity.polystage.neo4j;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.spi.adapter.AbstractBackendAdapter;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph adapter using the Neo4j Java driver.\n
 *
 * Holds one session, opened on first use and closed after a transient failure or {@link #close()}.
 * Statements run as auto-commit transactions.\n
 */
public final class Neo4jBackendAdapter extends AbstractBackendAdapter<Neo4jHandle> {
  private static final Logger log = LoggerFactory.getLogger(Neo4jBackendAdapter.class);

  private Session session;

  public Neo4jBackendAdapter(Neo4jHandle handle) {
    super(BackendKind.GRAPH, handle);
  }

  @Override
  public String bindMarker(String paramName) {
    return "$" + paramName;
  }

  @Override
  protected Object toNative(Object value, FieldType targetType) {
    return Neo4jValues.toNative(value, targetType);
  }

  @Override
  protected List<Map<String, Object>> doExecute(String query, Map<String, Object> params) {
    List<Record> records = session().run(query, params).list();
    List<Map<String, Object>> rows = new ArrayList<>(records.size());
    for (Record r : records) rows.add(Neo4jValues.toRow(r));
    return rows;
  }

  @Override
  protected boolean isTransient(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof ServiceUnavailableException
          || t instanceof SessionExpiredException
          || t instanceof TransientException) {
        return true;
      }
      if (t.getCause() == t) break;
    }
    return false;
  }

  @Override
  protected void resetConnection() {
    Session s = session;
    session = null;
    if (s == null) return;
    try {
      s.close();
    } catch (RuntimeException e) {
      log.warn("polystage.neo4j op=close handleId={} error={}", handle().id(), e.toString());
    }
  }

  private Session session() {
    if (session == null) {
      SessionConfig cfg = handle().database() == null
          ? SessionConfig.defaultConfig()
          : SessionConfig.forDatabase(handle().database());
      session = handle().client().session(cfg);
      log.debug("polystage.neo4j op=open handleId={} database={}", handle().id(), handle().database());
    }
    return session;
  }
}
