package io.intellixity.polystage.jdbc;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedSqlCompilerTest {

  @Test
  void rewritesNamedParamsInOrder() {
    SqlStatement ss = NamedSqlCompiler.compile(
        "SELECT * FROM movies WHERE year = :year AND title = :title OR year = :year",
        Map.of("year", 1999L, "title", "The Matrix"));
    assertEquals("SELECT * FROM movies WHERE year = ? AND title = ? OR year = ?", ss.sql());
    assertEquals(List.of(1999L, "The Matrix", 1999L), ss.binds());
  }

  @Test
  void ignoresCastsAndQuotedText() {
    SqlStatement ss = NamedSqlCompiler.compile(
        "SELECT id::text, ':notParam', \"odd:col\" FROM t WHERE a = :a AND b = 'it''s :x'",
        Map.of("a", 1));
    assertEquals("SELECT id::text, ':notParam', \"odd:col\" FROM t WHERE a = ? AND b = 'it''s :x'", ss.sql());
    assertEquals(List.of(1), ss.binds());
  }

  @Test
  void expandsCollections() {
    SqlStatement ss = NamedSqlCompiler.compile("SELECT * FROM t WHERE id IN (:ids)", Map.of("ids", List.of(1L, 2L, 3L)));
    assertEquals("SELECT * FROM t WHERE id IN (?, ?, ?)", ss.sql());
    assertEquals(List.of(1L, 2L, 3L), ss.binds());
  }

  @Test
  void emptyCollectionRendersNull() {
    SqlStatement ss = NamedSqlCompiler.compile("SELECT * FROM t WHERE id IN (:ids)", Map.of("ids", List.of()));
    assertEquals("SELECT * FROM t WHERE id IN (NULL)", ss.sql());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void nullValuesBind() {
    Map<String, Object> p = new HashMap<>();
    p.put("x", null);
    SqlStatement ss = NamedSqlCompiler.compile("SELECT :x", p);
    assertEquals(Arrays.asList((Object) null), ss.binds());
  }

  @Test
  void missingParamFails() {
    assertThrows(IllegalArgumentException.class, () -> NamedSqlCompiler.compile("SELECT :nope", Map.of()));
  }
}
