package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.MultipleValuesWarning;
import io.intellixity.polystage.model.PipelineResult;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.model.StageResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the labelled final result.\n
 *
 * Every stage with an output label contributes its rows, in ascending ordinal order. A plan without any
 * label exposes its final stage as {@code stage_<index>}.\n
 */
final class ResultMerger {
  static final String UNLABELLED_PREFIX = "stage_";

  private ResultMerger() {}

  static PipelineResult merge(Plan plan, ExecutionContext ctx, List<MultipleValuesWarning> warnings) {
    Map<String, List<Map<String, Object>>> outputs = new LinkedHashMap<>();
    for (Stage s : plan.stages()) {
      if (!s.isOutput()) continue;
      outputs.put(s.outputLabel(), rowsOf(ctx, s));
    }
    if (outputs.isEmpty()) {
      Stage last = plan.last();
      outputs.put(UNLABELLED_PREFIX + last.index(), rowsOf(ctx, last));
    }
    return new PipelineResult(outputs, warnings);
  }

  private static List<Map<String, Object>> rowsOf(ExecutionContext ctx, Stage s) {
    return ctx.get(s.index())
        .map(StageResult::rows)
        .orElseThrow(() -> new IllegalStateException("Stage " + s.index() + " has no result to merge"));
  }
}
