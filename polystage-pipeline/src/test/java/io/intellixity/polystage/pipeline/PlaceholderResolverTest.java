package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.error.UnresolvedReferenceException;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.model.StageResult;
import io.intellixity.polystage.pipeline.Fixtures.ScriptedAdapter;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.template.TemplateScanner;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.intellixity.polystage.pipeline.Fixtures.row;
import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderResolverTest {
  private final PlaceholderResolver resolver = new PlaceholderResolver(Fixtures.schemas());

  private BoundStage bind(Stage s) {
    return resolver.bind(s, TemplateScanner.scan(s.queryTemplate()));
  }

  private static ExecutionContext ctxWith(int stage, List<Map<String, Object>> rows) {
    ExecutionContext ctx = new ExecutionContext();
    ctx.put(new StageResult(stage, BackendKind.RELATIONAL, rows));
    return ctx;
  }

  @Test
  void bindsTargetTypeByLocatingTheField() {
    BoundStage b = bind(new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id = {{0.movie_id}}"));
    assertEquals(FieldType.INTEGER, b.targets().get(0).type());
  }

  @Test
  void explicitTargetOverridesFieldName() {
    BoundStage b = bind(new Stage(1, BackendKind.GRAPH, "MATCH (m:Movie {title: {{0.name@Movie.title}}}) RETURN m"));
    assertEquals(FieldType.STRING, b.targets().get(0).type());

    BoundStage unqualified = bind(new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id = {{0.id@movie_id}}"));
    assertEquals(FieldType.INTEGER, unqualified.targets().get(0).type());
  }

  @Test
  void undeclaredTargetIsCoercionError() {
    Stage s = new Stage(1, BackendKind.GRAPH, "MATCH (m:Movie {budget: {{0.budget}}}) RETURN m");
    CoercionException e = assertThrows(CoercionException.class, () -> bind(s));
    assertTrue(e.getMessage().contains("budget"));

    Stage qualified = new Stage(1, BackendKind.GRAPH, "MATCH (p:Person {title: {{0.title@Person.title}}}) RETURN p");
    assertThrows(CoercionException.class, () -> bind(qualified));
  }

  @Test
  void conflictingDeclarationsAreAmbiguous() {
    Stage s = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE score > {{0.score}}");
    CoercionException e = assertThrows(CoercionException.class, () -> bind(s));
    assertTrue(e.getMessage().contains("ambiguous"));

    BoundStage b = bind(new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE score > {{0.score@ratings.score}}"));
    assertEquals(FieldType.DECIMAL, b.targets().get(0).type());
  }

  @Test
  void replacesPlaceholdersWithGeneratedParameters() {
    Stage s = new Stage(1, BackendKind.RELATIONAL,
        "SELECT * FROM ratings WHERE movie_id IN ({{0.id|list}}) AND score > :min",
        Map.of("min", 3), null, List.of(), null);
    ResolvedQuery q = resolver.resolve(bind(s), ctxWith(0, List.of(row("id", 1), row("id", "2"), row("id", 1))),
        new ScriptedAdapter(BackendKind.RELATIONAL));

    assertEquals("SELECT * FROM ratings WHERE movie_id IN (:_ref1) AND score > :min", q.text());
    assertEquals(List.of("min", "_ref1"), List.copyOf(q.params().keySet()));
    assertEquals(List.of(1L, 2L, 1L), q.params().get("_ref1"));
    assertTrue(q.warnings().isEmpty());
  }

  @Test
  void distinctListKeepsFirstOccurrenceOrder() {
    Stage s = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id IN ({{0.id|distinct}})");
    ResolvedQuery q = resolver.resolve(bind(s), ctxWith(0, List.of(row("id", 3), row("id", 1), row("id", 3))),
        new ScriptedAdapter(BackendKind.RELATIONAL));
    assertEquals(List.of(3L, 1L), q.params().get("_ref1"));
  }

  @Test
  void quotedPlaceholderIsReplacedWithItsQuotes() {
    Stage s = new Stage(1, BackendKind.DOCUMENT,
        "{\"collection\": \"reviews\", \"filter\": {\"movie_id\": \"{{0.id}}\"}}");
    ResolvedQuery q = resolver.resolve(bind(s), ctxWith(0, List.of(row("id", new BigDecimal("42")))),
        new ScriptedAdapter(BackendKind.DOCUMENT));
    assertEquals("{\"collection\": \"reviews\", \"filter\": {\"movie_id\": {\"$param\": \"_ref1\"}}}", q.text());
    assertEquals(42L, q.params().get("_ref1"));
  }

  @Test
  void emptyResultGivesNullOrEmptyList() {
    Stage first = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id = {{0.id}}");
    ResolvedQuery q1 = resolver.resolve(bind(first), ctxWith(0, List.of()), new ScriptedAdapter(BackendKind.RELATIONAL));
    assertTrue(q1.params().containsKey("_ref1"));
    assertNull(q1.params().get("_ref1"));

    Stage list = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id IN ({{0.id|list}})");
    ResolvedQuery q2 = resolver.resolve(bind(list), ctxWith(0, List.of()), new ScriptedAdapter(BackendKind.RELATIONAL));
    assertEquals(List.of(), q2.params().get("_ref1"));
  }

  @Test
  void nestedPathsAndSparseRows() {
    Stage s = new Stage(1, BackendKind.GRAPH, "MATCH (m:Movie) WHERE m.title IN {{0.meta.title|list@title}} RETURN m");
    ResolvedQuery q = resolver.resolve(bind(s),
        ctxWith(0, List.of(row("meta", Map.of("title", "Heat")), row("other", 1), row("meta", Map.of("title", "Ronin")))),
        new ScriptedAdapter(BackendKind.GRAPH));
    assertEquals("MATCH (m:Movie) WHERE m.title IN $_ref1 RETURN m", q.text());
    assertEquals(List.of("Heat", "Ronin"), q.params().get("_ref1"));
  }

  @Test
  void nullValuesSurviveListPolicy() {
    Stage s = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id IN ({{0.id|list}})");
    ResolvedQuery q = resolver.resolve(bind(s), ctxWith(0, List.of(row("id", 1), row("id", null))),
        new ScriptedAdapter(BackendKind.RELATIONAL));
    assertEquals(Arrays.asList(1L, null), q.params().get("_ref1"));
  }

  @Test
  void unresolvedWhenStageMissingOrFieldAbsentEverywhere() {
    Stage s = new Stage(2, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id = {{1.id}}");
    BoundStage b = bind(s);
    ScriptedAdapter a = new ScriptedAdapter(BackendKind.RELATIONAL);

    UnresolvedReferenceException missing = assertThrows(UnresolvedReferenceException.class,
        () -> resolver.resolve(b, ctxWith(0, List.of(row("id", 1))), a));
    assertEquals(2, missing.stageIndex());
    assertEquals("1.id", missing.reference());

    assertThrows(UnresolvedReferenceException.class,
        () -> resolver.resolve(b, ctxWith(1, List.of(row("title", "Heat"))), a));
  }

  @Test
  void coercionFailureNamesThePlaceholder() {
    Stage s = new Stage(1, BackendKind.RELATIONAL, "SELECT * FROM ratings WHERE movie_id = {{0.id}}");
    CoercionException e = assertThrows(CoercionException.class, () -> resolver.resolve(bind(s),
        ctxWith(0, List.of(row("id", 7.5))), new ScriptedAdapter(BackendKind.RELATIONAL)));
    assertTrue(e.getMessage().contains("{{0.id}}"));
  }

  @Test
  void stageWithoutPlaceholdersPassesThrough() {
    Stage s = new Stage(0, BackendKind.RELATIONAL, "SELECT 1 WHERE x = :x", Map.of("x", 1), null, List.of(), null);
    ResolvedQuery q = resolver.resolve(bind(s), new ExecutionContext(), new ScriptedAdapter(BackendKind.RELATIONAL));
    assertEquals(s.queryTemplate(), q.text());
    assertEquals(Map.of("x", 1), q.params());
  }
}
