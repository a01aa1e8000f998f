package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.error.BackendException;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.pipeline.cache.InMemoryResultCache;
import io.intellixity.polystage.schema.JsonSchemaSource;
import io.intellixity.polystage.schema.SchemaRegistry;
import io.intellixity.polystage.spi.adapter.AbstractBackendAdapter;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import io.intellixity.polystage.spi.pool.BlockingAdapterPool;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** Shared test doubles: a movie schema, scripted adapters and a wired service context. */
final class Fixtures {
  static final String SCHEMA = """
      {
        "postgres": {
          "movies": [["id", "integer"], ["title", "character varying"], ["released", "date"]],
          "ratings": {"movie_id": "bigint", "score": "numeric"},
          "reviews_import": {"score": "text"}
        },
        "neo4j": {
          "nodes": {
            "('Movie',)": {"id": "INTEGER", "title": "STRING"},
            "('Person',)": {"name": "STRING"}
          },
          "relationships": {"ACTED_IN": ["roles"]}
        },
        "mongodb": {
          "reviews": {"movie_id": "int", "rating": "double", "created": "date"}
        }
      }
      """;

  private Fixtures() {}

  static SchemaRegistry schemas() {
    SchemaRegistry reg = new SchemaRegistry(JsonSchemaSource.fromJson(SCHEMA));
    reg.loadAll();
    return reg;
  }

  static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  record TestHandle(String id) implements AdapterHandle<Object> {
    @Override public Object client() { return this; }
    @Override public String namespace() { return null; }
  }

  record Call(String query, Map<String, Object> params) {}

  /**
   * Replays queued outcomes (rows or a {@link BackendException}) and records every call.
   * An exhausted script answers with no rows.
   */
  static final class ScriptedAdapter extends AbstractBackendAdapter<TestHandle> {
    final Deque<Object> outcomes = new ArrayDeque<>();
    final List<Call> calls = new ArrayList<>();
    Runnable afterCall = () -> {};

    ScriptedAdapter(BackendKind kind) {
      super(kind, new TestHandle(kind.schemaKey()));
    }

    ScriptedAdapter returning(List<Map<String, Object>> rows) {
      outcomes.add(rows);
      return this;
    }

    ScriptedAdapter failing(boolean transientError) {
      outcomes.add(new BackendException(kind(), transientError, transientError ? "connection reset" : "syntax error"));
      return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected List<Map<String, Object>> doExecute(String query, Map<String, Object> params) {
      calls.add(new Call(query, new LinkedHashMap<>(params)));
      Object next = outcomes.pollFirst();
      afterCall.run();
      if (next == null) return List.of();
      if (next instanceof BackendException e) throw e;
      return (List<Map<String, Object>>) next;
    }

    @Override protected boolean isTransient(Throwable error) { return false; }

    @Override protected void resetConnection() {}

    @Override
    public String bindMarker(String paramName) {
      return switch (kind()) {
        case RELATIONAL -> ":" + paramName;
        case GRAPH -> "$" + paramName;
        case DOCUMENT -> "{\"$param\": \"" + paramName + "\"}";
      };
    }
  }

  /** Scripted adapters for every backend kind wired into an executor with a controllable clock. */
  static final class Harness {
    final Map<BackendKind, ScriptedAdapter> adapters = new EnumMap<>(BackendKind.class);
    final AtomicLong clock = new AtomicLong(1_000_000L);
    final List<Duration> sleeps = new ArrayList<>();
    final InMemoryResultCache cache = new InMemoryResultCache(16, clock::get);
    final BlockingAdapterPool pool = new BlockingAdapterPool(Duration.ofSeconds(1));
    final ServiceContext services;
    final PipelineExecutor executor;

    Harness() {
      this(PipelineSettings.defaults());
    }

    Harness(PipelineSettings settings) {
      for (BackendKind k : BackendKind.values()) {
        ScriptedAdapter a = new ScriptedAdapter(k);
        adapters.put(k, a);
        pool.register(k, () -> a, 1);
      }
      services = new ServiceContext(schemas(), pool, cache, settings);
      executor = new PipelineExecutor(services, sleeps::add);
    }

    ScriptedAdapter adapter(BackendKind kind) {
      return adapters.get(kind);
    }

    int totalCalls() {
      int n = 0;
      for (ScriptedAdapter a : adapters.values()) n += a.calls.size();
      return n;
    }
  }
}
