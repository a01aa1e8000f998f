package io.intellixity.polystage.template;

import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.model.AggregationPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TemplateScannerTest {

  @Test
  void scansPlainReference() {
    List<Placeholder> ps = TemplateScanner.scan("MATCH (m:Movie) WHERE m.id = {{1.movie_id}} RETURN m");
    assertEquals(1, ps.size());
    Placeholder p = ps.get(0);
    assertEquals(1, p.stageIndex());
    assertEquals("movie_id", p.fieldPath());
    assertNull(p.policy());
    assertEquals(AggregationPolicy.FIRST, p.effectivePolicy());
    assertFalse(p.quoted());
    assertEquals("movie_id", p.targetProperty());
  }

  @Test
  void scansPolicyTargetAndWhitespace() {
    Placeholder p = TemplateScanner.scan("WHERE id IN ({{ 2.movie.id | distinct @ movies.id }})").get(0);
    assertEquals(2, p.stageIndex());
    assertEquals("movie.id", p.fieldPath());
    assertEquals("movie", p.rootField());
    assertEquals(AggregationPolicy.DISTINCT_LIST, p.policy());
    assertEquals("movies", p.targetEntity());
    assertEquals("id", p.targetField());
  }

  @Test
  void propertyOnlyTarget() {
    Placeholder p = TemplateScanner.scan("{{1.x@title}}").get(0);
    assertNull(p.targetEntity());
    assertEquals("title", p.targetProperty());
  }

  @Test
  void previousStageAliasIsAccepted() {
    Placeholder p = TemplateScanner.scan("WHERE title = {{previous_stage1.title}}").get(0);
    assertEquals(1, p.stageIndex());
    assertEquals("title", p.fieldPath());
  }

  @Test
  void quotedTokenSwallowsQuotes() {
    String t = "WHERE title = '{{1.title}}' AND name = \"{{1.name}}\"";
    List<Placeholder> ps = TemplateScanner.scan(t);
    assertEquals(2, ps.size());
    assertTrue(ps.get(0).quoted());
    assertEquals("'{{1.title}}'", ps.get(0).raw());
    String out = TemplateScanner.substitute(t, ps, p -> ":" + p.fieldPath());
    assertEquals("WHERE title = :title AND name = :name", out);
  }

  @Test
  void singleBracePreviousStageReadsWholeColumn() {
    String t = "SELECT m.id FROM movies m WHERE m.id IN ({previous_stage1.id}) AND m.gross > 100";
    List<Placeholder> ps = TemplateScanner.scan(t);
    assertEquals(1, ps.size());
    Placeholder p = ps.get(0);
    assertEquals(1, p.stageIndex());
    assertEquals("id", p.fieldPath());
    assertEquals(AggregationPolicy.LIST, p.effectivePolicy());
    assertTrue(p.policyExplicit());
    assertEquals("SELECT m.id FROM movies m WHERE m.id IN (:ids) AND m.gross > 100",
        TemplateScanner.substitute(t, ps, x -> ":ids"));
  }

  @Test
  void singleBraceAliasInsideDoubleBracesIsOneToken() {
    List<Placeholder> ps = TemplateScanner.scan("WHERE a = {{previous_stage2.a}} AND b = {previous_stage2.b}");
    assertEquals(2, ps.size());
    assertNull(ps.get(0).policy());
    assertEquals(AggregationPolicy.LIST, ps.get(1).policy());
  }

  @Test
  void malformedSingleBraceAliasIsInvalidPlan() {
    assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("WHERE id IN {previous_stage1}"));
    assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("WHERE id IN {previous_stage1.a b}"));
  }

  @Test
  void placeholderInsideLiteralIsInvalidPlan() {
    InvalidPlanException e = assertThrows(InvalidPlanException.class,
        () -> TemplateScanner.scan("SELECT * FROM movies WHERE title LIKE '%{{0.name}}%'"));
    assertTrue(e.getMessage().contains("{{0.name}}"));
    assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("x = '{{1.a}}\""));
    assertThrows(InvalidPlanException.class,
        () -> TemplateScanner.scan("MATCH (m) WHERE m.title = \"it\\\"s {{0.t}}\" RETURN m"));
  }

  @Test
  void literalsAroundPlaceholdersAreFine() {
    List<Placeholder> ps = TemplateScanner.scan(
        "SELECT * FROM movies WHERE note = 'it''s {x}' AND title LIKE '%' || {{0.name}} || '%'");
    assertEquals(1, ps.size());
    assertEquals("{{0.name}}", ps.get(0).raw());
  }

  @Test
  void unknownPolicyIsInvalidPlan() {
    InvalidPlanException e = assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("{{1.a|sum}}"));
    assertTrue(e.getMessage().contains("sum"));
  }

  @Test
  void malformedPlaceholderIsInvalidPlan() {
    assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("WHERE a = {{1.}}"));
    assertThrows(InvalidPlanException.class, () -> TemplateScanner.scan("WHERE a = {{1.a b}}"));
  }

  @Test
  void nonPlaceholderBracesAreLeftAlone() {
    assertTrue(TemplateScanner.scan("{\"collection\": \"c\", \"filter\": {\"a\": {\"$gt\": 1}}}").isEmpty());
    assertTrue(TemplateScanner.scan("").isEmpty());
  }
}
