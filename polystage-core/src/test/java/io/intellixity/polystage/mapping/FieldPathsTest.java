package io.intellixity.polystage.mapping;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FieldPathsTest {

  @Test
  void nestedAndLiteralKeys() {
    Map<String, Object> row = new HashMap<>();
    row.put("author", Map.of("name", "ann"));
    row.put("a.b", 5);
    row.put("nothing", null);

    assertEquals("ann", FieldPaths.get(row, "author.name"));
    assertEquals(5, FieldPaths.get(row, "a.b"));
    assertTrue(FieldPaths.has(row, "nothing"));
    assertNull(FieldPaths.get(row, "nothing"));
    assertFalse(FieldPaths.has(row, "author.age"));
    assertFalse(FieldPaths.has(row, "missing"));
  }
}
