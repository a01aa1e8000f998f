package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.error.CoercionException;
import io.intellixity.polystage.error.UnresolvedReferenceException;
import io.intellixity.polystage.mapping.FieldPaths;
import io.intellixity.polystage.model.AggregationPolicy;
import io.intellixity.polystage.model.MultipleValuesWarning;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.model.StageResult;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.schema.SchemaRegistry;
import io.intellixity.polystage.schema.SchemaSnapshot;
import io.intellixity.polystage.spi.adapter.BackendAdapter;
import io.intellixity.polystage.template.Placeholder;
import io.intellixity.polystage.template.TemplateScanner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fills a stage's placeholders from earlier stage results.\n
 *
 * Two phases:\n
 * - {@link #bind}: target types from the target backend's schema, before anything runs\n
 * - {@link #resolve}: values from the execution context, coerced by the target adapter and bound as
 *   generated parameters ({@code _ref1}, {@code _ref2}, ...); values never enter the query text\n
 */
public final class PlaceholderResolver {
  private final SchemaRegistry schemas;

  public PlaceholderResolver(SchemaRegistry schemas) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  /**
   * Look up the declared type of every placeholder target.\n
   *
   * Fails with {@link CoercionException} when the target is not declared or is declared with different
   * types by several entities, and with {@code SchemaNotLoadedException} when the target schema is missing.\n
   */
  public BoundStage bind(Stage stage, List<Placeholder> placeholders) {
    Objects.requireNonNull(stage, "stage");
    if (placeholders.isEmpty()) return new BoundStage(stage, List.of());
    SchemaSnapshot schema = schemas.get(stage.backend());
    List<BoundStage.Target> targets = new ArrayList<>(placeholders.size());
    for (Placeholder p : placeholders) targets.add(new BoundStage.Target(p, targetType(stage, schema, p)));
    return new BoundStage(stage, targets);
  }

  public ResolvedQuery resolve(BoundStage bound, ExecutionContext ctx, BackendAdapter adapter) {
    Objects.requireNonNull(bound, "bound");
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(adapter, "adapter");
    Stage stage = bound.stage();
    if (bound.targets().isEmpty()) return new ResolvedQuery(stage.queryTemplate(), stage.parameters(), List.of());

    Map<String, Object> params = new LinkedHashMap<>(stage.parameters());
    List<MultipleValuesWarning> warnings = new ArrayList<>();
    Map<Placeholder, String> markers = new LinkedHashMap<>();
    int n = 0;
    for (BoundStage.Target t : bound.targets()) {
      Placeholder p = t.placeholder();
      Object raw = extract(stage.index(), p, ctx, warnings);
      Object value;
      try {
        value = adapter.translatePlaceholderValue(raw, t.type());
      } catch (CoercionException e) {
        throw new CoercionException("Stage " + stage.index() + " placeholder {{" + p.reference() + "}}: " + e.getMessage(), e);
      }
      String name = PlanValidator.RESERVED_PARAM_PREFIX + (++n);
      params.put(name, value);
      markers.put(p, adapter.bindMarker(name));
    }
    List<Placeholder> ordered = new ArrayList<>(markers.keySet());
    String text = TemplateScanner.substitute(stage.queryTemplate(), ordered, markers::get);
    return new ResolvedQuery(text, params, warnings);
  }

  private FieldType targetType(Stage stage, SchemaSnapshot schema, Placeholder p) {
    String field = p.targetProperty();
    if (p.targetEntity() != null) {
      return schema.fieldType(p.targetEntity(), field).orElseThrow(() -> new CoercionException(
          "Stage " + stage.index() + " placeholder {{" + p.reference() + "}}: " + p.targetEntity() + "." + field
              + " is not declared in the " + stage.backend().schemaKey() + " schema"));
    }
    Map<String, FieldType> found = schema.locate(field);
    if (found.isEmpty()) {
      throw new CoercionException("Stage " + stage.index() + " placeholder {{" + p.reference() + "}}: field '" + field
          + "' is not declared in the " + stage.backend().schemaKey() + " schema");
    }
    Set<FieldType> types = new LinkedHashSet<>(found.values());
    if (types.size() > 1) {
      throw new CoercionException("Stage " + stage.index() + " placeholder {{" + p.reference() + "}}: field '" + field
          + "' is ambiguous " + found + "; qualify with @Entity." + field);
    }
    return types.iterator().next();
  }

  private static Object extract(int stageIndex, Placeholder p, ExecutionContext ctx, List<MultipleValuesWarning> warnings) {
    StageResult source = ctx.get(p.stageIndex()).orElseThrow(() ->
        new UnresolvedReferenceException(stageIndex, p.reference(), "stage " + p.stageIndex() + " has no result"));

    List<Object> values = new ArrayList<>(source.size());
    for (Map<String, Object> row : source.rows()) {
      if (FieldPaths.has(row, p.fieldPath())) values.add(FieldPaths.get(row, p.fieldPath()));
    }
    if (!source.isEmpty() && values.isEmpty()) {
      throw new UnresolvedReferenceException(stageIndex, p.reference(),
          "field '" + p.fieldPath() + "' not present in any row of stage " + p.stageIndex());
    }

    AggregationPolicy policy = p.effectivePolicy();
    return switch (policy) {
      case FIRST -> {
        if (values.isEmpty()) yield null;
        Object first = values.get(0);
        if (!p.policyExplicit()) {
          int distinct = new HashSet<>(values).size();
          if (distinct > 1) {
            warnings.add(new MultipleValuesWarning(stageIndex, p.stageIndex(), p.fieldPath(), distinct, first));
          }
        }
        yield first;
      }
      case LIST -> values;
      case DISTINCT_LIST -> new ArrayList<>(new LinkedHashSet<>(values));
    };
  }
}
