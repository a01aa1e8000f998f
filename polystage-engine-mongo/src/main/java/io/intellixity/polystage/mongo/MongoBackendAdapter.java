package io.intellixity.polystage.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.mongo.bind.MongoValueBinder;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.spi.adapter.AbstractBackendAdapter;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Document adapter using the official MongoDB Java sync driver.\n
 *
 * Holds one client session, started on first use and ended after a transient failure or {@link #close()}.\n
 */
public final class MongoBackendAdapter extends AbstractBackendAdapter<MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoBackendAdapter.class);

  static final String RETRYABLE_READ_LABEL = "RetryableReadError";
  static final String TRANSIENT_TX_LABEL = "TransientTransactionError";

  private ClientSession session;

  public MongoBackendAdapter(MongoHandle handle) {
    super(BackendKind.DOCUMENT, handle);
  }

  @Override
  public String bindMarker(String paramName) {
    return "{\"" + MongoQueryParser.PARAM_KEY + "\": \"" + paramName + "\"}";
  }

  @Override
  protected Object toNative(Object value, FieldType targetType) {
    return MongoValueBinder.toNative(value, targetType);
  }

  @Override
  protected List<Map<String, Object>> doExecute(String query, Map<String, Object> params) {
    MongoStatement st = MongoQueryParser.parse(query, params);
    if (log.isDebugEnabled()) {
      log.debug("polystage.mongo op={} database={} collection={} stages={}",
          st.kind(), handle().database(), st.collection(), st.pipeline().size());
    }
    MongoCollection<Document> col = handle().client().getDatabase(handle().database()).getCollection(st.collection());
    ClientSession s = session();

    Iterable<Document> docs;
    if (st.kind() == MongoStatement.Kind.AGGREGATE) {
      docs = col.aggregate(s, st.pipeline());
    } else {
      FindIterable<Document> find = col.find(s, st.filter());
      if (st.projection() != null) find = find.projection(st.projection());
      if (st.sort() != null) find = find.sort(st.sort());
      if (st.skip() != null) find = find.skip(st.skip());
      if (st.limit() != null) find = find.limit(st.limit());
      docs = find;
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Document d : docs) rows.add(MongoRows.toRow(d));
    return rows;
  }

  @Override
  protected boolean isTransient(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof MongoSocketException
          || t instanceof MongoTimeoutException
          || t instanceof MongoNotPrimaryException
          || t instanceof MongoNodeIsRecoveringException) {
        return true;
      }
      if (t instanceof MongoException me
          && (me.hasErrorLabel(RETRYABLE_READ_LABEL) || me.hasErrorLabel(TRANSIENT_TX_LABEL))) {
        return true;
      }
      if (t.getCause() == t) break;
    }
    return false;
  }

  @Override
  protected void resetConnection() {
    ClientSession s = session;
    session = null;
    if (s == null) return;
    try {
      s.close();
    } catch (RuntimeException e) {
      log.warn("polystage.mongo op=close handleId={} error={}", handle().id(), e.toString());
    }
  }

  private ClientSession session() {
    if (session == null) {
      session = handle().client().startSession();
      log.debug("polystage.mongo op=open handleId={} database={}", handle().id(), handle().database());
    }
    return session;
  }
}
