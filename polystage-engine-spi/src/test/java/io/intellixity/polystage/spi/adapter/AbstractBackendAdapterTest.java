package io.intellixity.polystage.spi.adapter;

import io.intellixity.polystage.error.BackendException;
import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.spi.handle.AdapterHandle;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractBackendAdapterTest {

  record TestHandle(String id) implements AdapterHandle<Object> {
    @Override public Object client() { return this; }
    @Override public String namespace() { return null; }
  }

  /** Replays queued outcomes; IOException counts as transient. */
  static final class ReplayAdapter extends AbstractBackendAdapter<TestHandle> {
    final Deque<Object> outcomes = new ArrayDeque<>();
    int resets;
    Map<String, Object> lastParams;

    ReplayAdapter() {
      super(BackendKind.GRAPH, new TestHandle("test"));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected List<Map<String, Object>> doExecute(String query, Map<String, Object> params) throws Exception {
      lastParams = params;
      Object next = outcomes.removeFirst();
      if (next instanceof Exception e) throw e;
      return (List<Map<String, Object>>) next;
    }

    @Override protected boolean isTransient(Throwable error) { return error instanceof IOException; }

    @Override protected void resetConnection() { resets++; }

    @Override
    protected Object toNative(Object value, FieldType targetType) {
      return targetType == FieldType.UUID ? value.toString() : value;
    }

    @Override public String bindMarker(String paramName) { return "$" + paramName; }
  }

  @Test
  void returnsRowsAndPassesEmptyParamsForNull() {
    ReplayAdapter a = new ReplayAdapter();
    a.outcomes.add(List.of(Map.of("x", 1)));
    assertEquals(List.of(Map.of("x", 1)), a.execute("RETURN 1 AS x", null));
    assertEquals(Map.of(), a.lastParams);
  }

  @Test
  void transientFailureResetsConnection() {
    ReplayAdapter a = new ReplayAdapter();
    a.outcomes.add(new IOException("connection reset"));
    BackendException e = assertThrows(BackendException.class, () -> a.execute("RETURN 1", Map.of()));
    assertTrue(e.isTransient());
    assertEquals(BackendKind.GRAPH, e.backend());
    assertEquals(1, a.resets);
  }

  @Test
  void permanentFailureKeepsConnection() {
    ReplayAdapter a = new ReplayAdapter();
    a.outcomes.add(new IllegalArgumentException("syntax error"));
    BackendException e = assertThrows(BackendException.class, () -> a.execute("RETRUN 1", Map.of()));
    assertFalse(e.isTransient());
    assertEquals(0, a.resets);
  }

  @Test
  void closedAdapterRejectsExecute() {
    ReplayAdapter a = new ReplayAdapter();
    a.close();
    a.close();
    assertEquals(1, a.resets);
    assertThrows(IllegalStateException.class, () -> a.execute("RETURN 1", Map.of()));
  }

  @Test
  void translateCoercesThenConvertsElementWise() {
    ReplayAdapter a = new ReplayAdapter();
    assertEquals(5L, a.translatePlaceholderValue("5", FieldType.INTEGER));
    assertEquals(List.of(1L, 2L), a.translatePlaceholderValue(List.of(1, "2"), FieldType.INTEGER));
    String u = "123e4567-e89b-12d3-a456-426614174000";
    assertEquals(u, a.translatePlaceholderValue(u, FieldType.UUID));
    assertNull(a.translatePlaceholderValue(null, FieldType.UUID));
    assertThrows(CoercionException.class, () -> a.translatePlaceholderValue("x", FieldType.INTEGER));
  }
}
