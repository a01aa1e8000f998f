package io.intellixity.polystage.plan;

import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PlanFingerprinterTest {

  private static Plan plan(String sql, String cypher) {
    return Plan.of(
        new Stage(1, BackendKind.RELATIONAL, sql),
        new Stage(2, BackendKind.GRAPH, cypher, "people"));
  }

  @Test
  void deterministicAndHex() {
    Plan a = plan("SELECT id FROM movies", "MATCH (p) WHERE p.id = {{1.id}} RETURN p");
    Plan b = plan("SELECT id FROM movies", "MATCH (p) WHERE p.id = {{1.id}} RETURN p");
    assertEquals(a.fingerprint(), b.fingerprint());
    assertTrue(a.fingerprint().matches("[0-9a-f]{64}"));
  }

  @Test
  void whitespaceInsensitive() {
    Plan a = plan("SELECT id FROM movies", "MATCH (p) WHERE p.id = {{1.id}} RETURN p");
    Plan b = plan("  SELECT   id\nFROM movies ", "MATCH (p)\n  WHERE p.id={{1.id}}\n  RETURN p");
    assertEquals(a.fingerprint(), b.fingerprint());
  }

  @Test
  void relationalKeywordCaseCollides() {
    Plan a = plan("SELECT id FROM movies", "MATCH (p:Person) RETURN p");
    Plan b = plan("select ID from Movies", "MATCH (p:Person) RETURN p");
    assertEquals(a.fingerprint(), b.fingerprint());
  }

  @Test
  void literalsPlaceholdersAndGraphLabelsKeepCase() {
    Plan a = plan("SELECT id FROM movies WHERE t = 'A'", "MATCH (p:Person) RETURN p");
    assertNotEquals(a.fingerprint(), plan("SELECT id FROM movies WHERE t = 'a'", "MATCH (p:Person) RETURN p").fingerprint());
    assertNotEquals(a.fingerprint(), plan("SELECT id FROM movies WHERE t = 'A'", "MATCH (p:person) RETURN p").fingerprint());
    assertNotEquals(
        PlanFingerprinter.fingerprint(List.of(new Stage(2, BackendKind.RELATIONAL, "SELECT * FROM t WHERE a = {{1.Name}}"))),
        PlanFingerprinter.fingerprint(List.of(new Stage(2, BackendKind.RELATIONAL, "SELECT * FROM t WHERE a = {{1.name}}"))));
  }

  @Test
  void stageOrderMatters() {
    Plan a = Plan.of(new Stage(1, BackendKind.RELATIONAL, "SELECT 1"), new Stage(2, BackendKind.RELATIONAL, "SELECT 2"));
    Plan b = Plan.of(new Stage(1, BackendKind.RELATIONAL, "SELECT 2"), new Stage(2, BackendKind.RELATIONAL, "SELECT 1"));
    assertNotEquals(a.fingerprint(), b.fingerprint());
  }

  @Test
  void parameterOrderAndLabelsMatter() {
    Map<String, Object> ab = new LinkedHashMap<>();
    ab.put("a", 1);
    ab.put("b", 2);
    Map<String, Object> ba = new LinkedHashMap<>();
    ba.put("b", 2);
    ba.put("a", 1);
    Stage s = new Stage(1, BackendKind.RELATIONAL, "SELECT :a, :b");
    assertNotEquals(
        PlanFingerprinter.fingerprint(List.of(s.withParameters(ab))),
        PlanFingerprinter.fingerprint(List.of(s.withParameters(ba))));
    assertNotEquals(
        PlanFingerprinter.fingerprint(List.of(new Stage(1, BackendKind.RELATIONAL, "SELECT 1", "x"))),
        PlanFingerprinter.fingerprint(List.of(new Stage(1, BackendKind.RELATIONAL, "SELECT 1", "y"))));
  }
}
